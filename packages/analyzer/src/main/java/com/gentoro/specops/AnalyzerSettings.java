package com.gentoro.specops;

import com.gentoro.specops.exception.ConfigException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable analyzer settings. Built from {@code analyzer.*} configuration keys, falling back to
 * compiled-in defaults for anything not configured:
 *
 * <ul>
 *   <li>{@code analyzer.discovery.extensions} - Markdown file extensions (with leading dot)
 *   <li>{@code analyzer.discovery.skipDirectories} - extra directory names never descended into
 *   <li>{@code analyzer.discovery.maxDepth} - recursion cap for the directory walk
 *   <li>{@code analyzer.extraction.parallelism} - worker threads for per-file extraction
 *   <li>{@code analyzer.prerequisites.minMatchLength} - shortest file stem or concept name that
 *       may resolve a prerequisite
 * </ul>
 */
public final class AnalyzerSettings {
  public static final Set<String> DEFAULT_EXTENSIONS =
      Set.of(".md", ".markdown", ".mdown", ".mkd");
  public static final Set<String> DEFAULT_SKIP_DIRECTORIES =
      Set.of(".git", ".kiro", "__pycache__", "node_modules", ".pytest_cache");
  public static final int DEFAULT_MAX_DEPTH = 64;
  public static final int DEFAULT_MIN_MATCH_LENGTH = 3;

  private final Set<String> extensions;
  private final Set<String> skipDirectories;
  private final int maxDepth;
  private final int parallelism;
  private final int prerequisiteMinMatchLength;

  private AnalyzerSettings(
      Set<String> extensions,
      Set<String> skipDirectories,
      int maxDepth,
      int parallelism,
      int prerequisiteMinMatchLength) {
    if (extensions.isEmpty()) {
      throw new ConfigException("analyzer.discovery.extensions must not be empty");
    }
    if (maxDepth < 1) {
      throw new ConfigException("analyzer.discovery.maxDepth must be >= 1, got " + maxDepth);
    }
    if (parallelism < 1) {
      throw new ConfigException(
          "analyzer.extraction.parallelism must be >= 1, got " + parallelism);
    }
    if (prerequisiteMinMatchLength < 1) {
      throw new ConfigException(
          "analyzer.prerequisites.minMatchLength must be >= 1, got "
              + prerequisiteMinMatchLength);
    }
    this.extensions = Set.copyOf(extensions);
    this.skipDirectories = Set.copyOf(skipDirectories);
    this.maxDepth = maxDepth;
    this.parallelism = parallelism;
    this.prerequisiteMinMatchLength = prerequisiteMinMatchLength;
  }

  public static AnalyzerSettings defaults() {
    return new AnalyzerSettings(
        DEFAULT_EXTENSIONS,
        DEFAULT_SKIP_DIRECTORIES,
        DEFAULT_MAX_DEPTH,
        Runtime.getRuntime().availableProcessors(),
        DEFAULT_MIN_MATCH_LENGTH);
  }

  public static AnalyzerSettings from(Configuration cfg) {
    if (cfg == null) return defaults();
    List<String> ext = cfg.getList(String.class, "analyzer.discovery.extensions", List.of());
    List<String> skip = cfg.getList(String.class, "analyzer.discovery.skipDirectories", List.of());
    return new AnalyzerSettings(
        ext.isEmpty() ? DEFAULT_EXTENSIONS : normalizeExtensions(ext),
        withDefaultSkips(skip),
        cfg.getInt("analyzer.discovery.maxDepth", DEFAULT_MAX_DEPTH),
        cfg.getInt(
            "analyzer.extraction.parallelism", Runtime.getRuntime().availableProcessors()),
        cfg.getInt("analyzer.prerequisites.minMatchLength", DEFAULT_MIN_MATCH_LENGTH));
  }

  // configured names extend the built-in skip set
  private static Set<String> withDefaultSkips(List<String> configured) {
    Set<String> out = new LinkedHashSet<>(DEFAULT_SKIP_DIRECTORIES);
    for (String s : configured) {
      if (s != null && !s.isBlank()) out.add(s.trim());
    }
    return out;
  }

  private static Set<String> normalizeExtensions(Collection<String> raw) {
    Set<String> out = new LinkedHashSet<>();
    for (String e : raw) {
      if (e == null || e.isBlank()) continue;
      String t = e.trim().toLowerCase(Locale.ROOT);
      out.add(t.startsWith(".") ? t : "." + t);
    }
    return out;
  }

  public AnalyzerSettings withParallelism(int parallelism) {
    return new AnalyzerSettings(
        extensions, skipDirectories, maxDepth, parallelism, prerequisiteMinMatchLength);
  }

  public AnalyzerSettings withMaxDepth(int maxDepth) {
    return new AnalyzerSettings(
        extensions, skipDirectories, maxDepth, parallelism, prerequisiteMinMatchLength);
  }

  public Set<String> extensions() {
    return extensions;
  }

  public Set<String> skipDirectories() {
    return skipDirectories;
  }

  public int maxDepth() {
    return maxDepth;
  }

  public int parallelism() {
    return parallelism;
  }

  public int prerequisiteMinMatchLength() {
    return prerequisiteMinMatchLength;
  }

  /** True when the file name carries one of the configured Markdown extensions. */
  public boolean isMarkdown(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (String ext : extensions) {
      if (lower.endsWith(ext)) return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return "AnalyzerSettings{"
        + "extensions="
        + extensions
        + ", skipDirectories="
        + skipDirectories
        + ", maxDepth="
        + maxDepth
        + ", parallelism="
        + parallelism
        + ", prerequisiteMinMatchLength="
        + prerequisiteMinMatchLength
        + '}';
  }
}
