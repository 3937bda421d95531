package com.gentoro.specops.discovery;

import com.gentoro.specops.model.RepositoryAnalysis;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a walked tree as nested maps: each subdirectory becomes a key holding its own map and
 * a directory's file names (all files, not only Markdown) are listed under {@code _files}.
 */
public final class FileStructureBuilder {
  private FileStructureBuilder() {}

  public static Map<String, Object> build(DirectoryNode root) {
    if (root == null) return Map.of();
    return toMap(root);
  }

  private static Map<String, Object> toMap(DirectoryNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (DirectoryNode child : node.children()) {
      map.put(child.name(), toMap(child));
    }
    if (!node.files().isEmpty()) {
      List<String> names = new ArrayList<>(node.files().size());
      for (Path f : node.files()) {
        names.add(f.getFileName().toString());
      }
      map.put(RepositoryAnalysis.FILES_KEY, names);
    }
    return map;
  }
}
