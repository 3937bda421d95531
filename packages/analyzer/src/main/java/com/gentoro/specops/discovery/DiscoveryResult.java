package com.gentoro.specops.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * Markdown files found under {@code root} in walk order, plus anything the walk could not do.
 *
 * @param tree the walked directory tree, {@code null} when the root does not exist
 */
public record DiscoveryResult(
    Path root, List<Path> files, List<String> warnings, DirectoryNode tree) {

  public DiscoveryResult {
    files = List.copyOf(files);
    warnings = List.copyOf(warnings);
  }

  public static DiscoveryResult missingRoot(Path root) {
    return new DiscoveryResult(
        root, List.of(), List.of("Repository path does not exist: " + root), null);
  }

  public boolean rootExists() {
    return tree != null;
  }

  /** {@code file} relative to the root with forward slashes, e.g. {@code docs/api.md}. */
  public String relativePath(Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
