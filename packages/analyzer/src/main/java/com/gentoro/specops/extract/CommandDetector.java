package com.gentoro.specops.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds shell-like commands in prose: inline code spans, "Run: ..." / "Run ..." phrases, {@code $}
 * prompts, {@code >} prompts and lines that start with a well-known tool invocation.
 */
public final class CommandDetector {
  private CommandDetector() {}

  private static final List<String> INDICATORS =
      List.of(
          "pip install",
          "npm install",
          "yarn add",
          "git clone",
          "cd ",
          "mkdir",
          "python ",
          "node ",
          "java ",
          "make",
          "cmake",
          "docker",
          "apt-get",
          "yum install",
          "brew install",
          "mvn ",
          "gradle ");

  // "make" is left out here: "make sure you have ..." is prose
  private static final List<String> COMMAND_PREFIXES =
      List.of(
          "pip ", "pip3 ", "npm ", "yarn ", "git ", "cd ", "mkdir ", "python ", "python3 ",
          "node ", "java ", "cmake ", "docker ", "apt-get ", "sudo ", "yum ", "brew ", "mvn ",
          "gradle ", "./");

  private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
  private static final Pattern LABELLED =
      Pattern.compile("\\b(?:run|execute|type):\\s*(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern IMPERATIVE =
      Pattern.compile("\\b(?:run|execute|type)\\s+(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOLLAR_PROMPT = Pattern.compile("\\$\\s*(.+)");
  private static final Pattern ANGLE_PROMPT = Pattern.compile("(?m)^\\s*>\\s*(.+)");

  public static boolean looksLikeCommand(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    for (String indicator : INDICATORS) {
      if (lower.contains(indicator)) return true;
    }
    return false;
  }

  static boolean startsWithCommand(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    for (String prefix : COMMAND_PREFIXES) {
      if (lower.startsWith(prefix)) return true;
    }
    return false;
  }

  /** Commands in order of first appearance, without duplicates. */
  public static List<String> detect(String text) {
    Set<String> out = new LinkedHashSet<>();
    if (text == null || text.isBlank()) return new ArrayList<>(out);

    Matcher code = INLINE_CODE.matcher(text);
    while (code.find()) {
      addIf(out, code.group(1), false);
    }
    collect(out, LABELLED, text, false);
    collect(out, IMPERATIVE, text, true);
    collect(out, DOLLAR_PROMPT, text, false);
    collect(out, ANGLE_PROMPT, text, false);

    String whole = clean(text);
    if (startsWithCommand(whole) && !whole.contains("\n")) {
      out.add(whole);
    }
    return new ArrayList<>(out);
  }

  private static void collect(Set<String> out, Pattern p, String text, boolean strict) {
    Matcher m = p.matcher(text);
    while (m.find()) {
      addIf(out, m.group(1), strict);
    }
  }

  private static void addIf(Set<String> out, String candidate, boolean strict) {
    String c = clean(candidate);
    if (c.isEmpty()) return;
    if (strict ? startsWithCommand(c) : looksLikeCommand(c)) {
      out.add(c);
    }
  }

  private static String clean(String raw) {
    String c = raw.replace("`", "").strip();
    while (c.endsWith(".") || c.endsWith(",") || c.endsWith(";")) {
      c = c.substring(0, c.length() - 1).strip();
    }
    return c;
  }
}
