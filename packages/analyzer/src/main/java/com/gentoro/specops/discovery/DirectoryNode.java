package com.gentoro.specops.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * One visited directory: its regular files and its walked subdirectories, both sorted by name.
 */
public record DirectoryNode(Path path, List<Path> files, List<DirectoryNode> children) {

  public DirectoryNode {
    files = List.copyOf(files);
    children = List.copyOf(children);
  }

  public String name() {
    Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }
}
