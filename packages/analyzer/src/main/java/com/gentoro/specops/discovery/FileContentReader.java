package com.gentoro.specops.discovery;

import com.gentoro.specops.exception.IoException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads files as strict UTF-8. */
public class FileContentReader implements ContentReader {

  @Override
  public String read(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      throw new IoException("File is not valid UTF-8: " + file, e);
    } catch (IOException e) {
      throw new IoException("Could not read file " + file + ": " + e.getMessage(), e);
    }
  }
}
