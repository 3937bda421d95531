package com.gentoro.specops.extract;

/** Decides whether a heading introduces a concept section or a setup section. */
public final class HeadingClassifier {
  private HeadingClassifier() {}

  public static final RuleTable<String> CONCEPT_KEYWORDS =
      RuleTable.keywords(
          "overview", "architecture", "design", "concepts", "introduction", "about", "what is");

  public static final RuleTable<String> SETUP_KEYWORDS =
      RuleTable.keywords(
          "install",
          "setup",
          "configuration",
          "getting started",
          "prerequisites",
          "requirements",
          "dependencies");

  public static boolean isConcept(String headingText) {
    return CONCEPT_KEYWORDS.anyMatch(headingText);
  }

  public static boolean isSetup(String headingText) {
    return SETUP_KEYWORDS.anyMatch(headingText);
  }
}
