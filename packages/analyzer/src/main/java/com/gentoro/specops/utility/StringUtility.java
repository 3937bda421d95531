package com.gentoro.specops.utility;

import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Cut {@code input} to {@code limit} chars, appending "..." when something was dropped. */
  public static String truncate(String input, int limit) {
    if (input == null) return "";
    return input.length() > limit ? input.substring(0, limit) + "..." : input;
  }

  /**
   * Like {@link #truncate(String, int)} but keeps the whole result within {@code maxLength},
   * ellipsis included.
   */
  public static String abbreviate(String input, int maxLength) {
    if (input == null) return "";
    if (input.length() <= maxLength) return input;
    return input.substring(0, Math.max(0, maxLength - 3)) + "...";
  }

  public static String collapseWhitespace(String input) {
    if (input == null) return "";
    return WHITESPACE.matcher(input).replaceAll(" ").trim();
  }

  public static int wordCount(String input) {
    if (input == null || input.isBlank()) return 0;
    return WHITESPACE.split(input.trim()).length;
  }

  /** "getting-started_guide" becomes "getting started guide". */
  public static String humanize(String stem) {
    if (stem == null) return "";
    return stem.replace('_', ' ').replace('-', ' ');
  }

  /** True when {@code needle} occurs in {@code haystack} as a whole word (case-insensitive). */
  public static boolean containsWord(String haystack, String needle) {
    if (haystack == null || needle == null || needle.isEmpty()) return false;
    Pattern p =
        Pattern.compile(
            "(?<![\\p{Alnum}])" + Pattern.quote(needle) + "(?![\\p{Alnum}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    return p.matcher(haystack).find();
  }
}
