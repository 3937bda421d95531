package com.gentoro.specops.extract;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mines free-text prerequisite phrases ("Requires: Java 17, Maven", "make sure you have ...").
 * Phrases are split on commas, semicolons and "and"; items of 100 chars or more are discarded.
 */
public final class PrerequisiteExtractor {
  private PrerequisiteExtractor() {}

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile(
              "(?:prerequisite|requirement|need|require)s?:?\\s*(.+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "before\\s+(?:you\\s+)?(?:can\\s+)?(?:start|begin|use)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("make sure\\s+(?:you\\s+)?(?:have|install)", Pattern.CASE_INSENSITIVE));

  private static final Pattern ITEM_SEPARATOR = Pattern.compile("[,;]|\\sand\\s");
  private static final Pattern TRAILING_DOTS = Pattern.compile("\\.+$");
  static final int MAX_ITEM_LENGTH = 100;

  public static Set<String> extract(String content) {
    Set<String> out = new LinkedHashSet<>();
    if (content == null || content.isEmpty()) return out;
    for (Pattern p : PATTERNS) {
      Matcher m = p.matcher(content);
      while (m.find()) {
        String phrase = m.groupCount() >= 1 ? m.group(1) : m.group();
        for (String item : ITEM_SEPARATOR.split(phrase)) {
          String cleaned = TRAILING_DOTS.matcher(item.strip()).replaceAll("");
          if (!cleaned.isEmpty() && cleaned.length() < MAX_ITEM_LENGTH) {
            out.add(cleaned);
          }
        }
      }
    }
    return out;
  }
}
