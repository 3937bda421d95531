package com.gentoro.specops.discovery;

import com.gentoro.specops.AnalyzerSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds documentation files under a repository root. Never throws for a bad root: a missing or
 * non-directory root yields an empty result whose warning is also logged.
 */
public class MarkdownFileDiscovery {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(MarkdownFileDiscovery.class);

  private final AnalyzerSettings settings;
  private final DirectoryWalker walker;

  public MarkdownFileDiscovery(AnalyzerSettings settings) {
    this.settings = settings;
    this.walker = new DirectoryWalker(settings);
  }

  public DiscoveryResult discover(Path root) {
    if (root == null || !Files.isDirectory(root)) {
      DiscoveryResult missing = DiscoveryResult.missingRoot(root);
      missing.warnings().forEach(log::warn);
      return missing;
    }
    DirectoryWalker.Result walked = walker.walk(root);
    List<Path> markdown = new ArrayList<>();
    collect(walked.root(), markdown);
    walked.warnings().forEach(log::warn);
    log.debug("Discovered {} markdown files under {}", markdown.size(), root);
    return new DiscoveryResult(root, markdown, walked.warnings(), walked.root());
  }

  // files of a directory come before those of its subdirectories
  private void collect(DirectoryNode node, List<Path> out) {
    for (Path f : node.files()) {
      if (settings.isMarkdown(f.getFileName().toString())) {
        out.add(f);
      }
    }
    for (DirectoryNode child : node.children()) {
      collect(child, out);
    }
  }
}
