package com.gentoro.specops.extract;

import java.util.Locale;

/** Keyword sniffing for fenced blocks that carry no language tag. */
public final class LanguageDetector {
  private LanguageDetector() {}

  public static final String FALLBACK = "text";

  static final RuleTable<String> RULES =
      RuleTable.<String>builder()
          .when("python", c -> c.contains("def ") && c.contains("import "), "python")
          .when(
              "javascript",
              c -> c.contains("function ") || c.contains("const ") || c.contains("let "),
              "javascript")
          .when("java", c -> c.contains("public class ") || c.contains("import java"), "java")
          .when("c", c -> c.contains("#include") || c.contains("int main("), "c")
          .when(
              "bash",
              c -> c.contains("echo ") || c.contains("ls ") || c.contains("cd "),
              "bash")
          .when(
              "sql",
              c -> {
                String upper = c.toUpperCase(Locale.ROOT);
                return upper.contains("SELECT ") || upper.contains("FROM ");
              },
              "sql")
          .build();

  public static String detect(String code) {
    return RULES.lookup(code, FALLBACK);
  }
}
