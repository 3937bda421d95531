package com.gentoro.specops.relationships;

import com.gentoro.specops.AnalyzerSettings;
import com.gentoro.specops.markdown.MarkdownPrimitives;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * File A depends on file B when A mentions B's file name (case-insensitive) or B's relative path,
 * or when A links to a Markdown target that resolves to B. A file never depends on itself.
 */
class FileDependencyAnalyzer {
  private final AnalyzerSettings settings;

  FileDependencyAnalyzer(AnalyzerSettings settings) {
    this.settings = settings;
  }

  Map<String, List<String>> analyze(Map<String, String> contentMap) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : contentMap.entrySet()) {
      String path = e.getKey();
      String content = e.getValue();
      String lower = content.toLowerCase(Locale.ROOT);
      Set<String> deps = new TreeSet<>();

      for (String other : contentMap.keySet()) {
        if (other.equals(path)) continue;
        if (lower.contains(fileName(other).toLowerCase(Locale.ROOT)) || content.contains(other)) {
          deps.add(other);
        }
      }
      for (MarkdownPrimitives.LinkMatch link : MarkdownPrimitives.links(content)) {
        String target = resolveLink(path, link.target());
        if (target != null && !target.equals(path) && contentMap.containsKey(target)) {
          deps.add(target);
        }
      }
      out.put(path, List.copyOf(deps));
    }
    return out;
  }

  /**
   * Resolve a link target against the linking file's directory. A leading {@code /} means the
   * repository root. Returns {@code null} for external URLs, non-Markdown targets and paths that
   * climb above the root.
   */
  String resolveLink(String fromPath, String rawTarget) {
    String target = rawTarget.strip();
    int space = target.indexOf(' ');
    if (space > 0) target = target.substring(0, space); // [x](file.md "title")
    int anchor = target.indexOf('#');
    if (anchor >= 0) target = target.substring(0, anchor);
    int query = target.indexOf('?');
    if (query >= 0) target = target.substring(0, query);
    if (target.isEmpty() || target.contains("://") || target.startsWith("mailto:")) return null;
    if (!settings.isMarkdown(fileName(target))) return null;

    if (target.startsWith("/")) {
      return normalize(target.substring(1));
    }
    int slash = fromPath.lastIndexOf('/');
    String base = slash < 0 ? "" : fromPath.substring(0, slash + 1);
    return normalize(base + target);
  }

  static String normalize(String path) {
    Deque<String> parts = new ArrayDeque<>();
    for (String part : path.replace('\\', '/').split("/")) {
      if (part.isEmpty() || part.equals(".")) continue;
      if (part.equals("..")) {
        if (parts.isEmpty()) return null;
        parts.removeLast();
      } else {
        parts.addLast(part);
      }
    }
    return parts.isEmpty() ? null : String.join("/", parts);
  }

  static String fileName(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? path : path.substring(slash + 1);
  }
}
