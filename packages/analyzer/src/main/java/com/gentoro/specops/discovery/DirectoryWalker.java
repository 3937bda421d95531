package com.gentoro.specops.discovery;

import com.gentoro.specops.AnalyzerSettings;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first directory walk shared by Markdown discovery and the file-structure tree.
 *
 * <p>Directories named in {@link AnalyzerSettings#skipDirectories()} are not entered. Symbolic
 * links are followed, but every directory is entered at most once by real path and the walk
 * stops at {@link AnalyzerSettings#maxDepth()}, so link cycles terminate. Unreadable directories
 * are reported as warnings and skipped.
 */
class DirectoryWalker {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(DirectoryWalker.class);

  record Result(DirectoryNode root, List<String> warnings) {}

  private final AnalyzerSettings settings;

  DirectoryWalker(AnalyzerSettings settings) {
    this.settings = settings;
  }

  /** Caller guarantees {@code root} is an existing directory. */
  Result walk(Path root) {
    List<String> warnings = new ArrayList<>();
    Set<Path> visited = new HashSet<>();
    DirectoryNode node = visit(root, 0, visited, warnings);
    return new Result(node, warnings);
  }

  private DirectoryNode visit(Path dir, int depth, Set<Path> visited, List<String> warnings) {
    try {
      if (!visited.add(dir.toRealPath())) {
        log.debug("Skipping already visited directory {}", dir);
        return new DirectoryNode(dir, List.of(), List.of());
      }
    } catch (IOException e) {
      warnings.add("Cannot resolve directory " + dir + ": " + e.getMessage());
      return new DirectoryNode(dir, List.of(), List.of());
    }

    List<Path> entries = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      for (Path p : stream) {
        entries.add(p);
      }
    } catch (IOException e) {
      warnings.add("Cannot list directory " + dir + ": " + e.getMessage());
      return new DirectoryNode(dir, List.of(), List.of());
    }
    entries.sort(Comparator.comparing(p -> p.getFileName().toString()));

    List<Path> files = new ArrayList<>();
    List<DirectoryNode> children = new ArrayList<>();
    for (Path entry : entries) {
      String name = entry.getFileName().toString();
      if (Files.isDirectory(entry)) {
        if (settings.skipDirectories().contains(name)) continue;
        if (depth + 1 > settings.maxDepth()) {
          warnings.add("Maximum depth " + settings.maxDepth() + " reached at " + entry);
          continue;
        }
        children.add(visit(entry, depth + 1, visited, warnings));
      } else if (Files.isRegularFile(entry)) {
        files.add(entry);
      }
    }
    return new DirectoryNode(dir, files, children);
  }
}
