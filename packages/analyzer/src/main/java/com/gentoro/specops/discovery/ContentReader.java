package com.gentoro.specops.discovery;

import com.gentoro.specops.exception.IoException;
import java.nio.file.Path;

/** Source of file text. The analyzer reads documentation only through this seam. */
@FunctionalInterface
public interface ContentReader {

  /**
   * @throws IoException when the file is missing, unreadable or not valid UTF-8
   */
  String read(Path file);
}
