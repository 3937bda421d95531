package com.gentoro.specops.relationships;

import com.gentoro.specops.extract.RuleTable;
import com.gentoro.specops.markdown.MarkdownDocument;
import java.util.Locale;

/** Scores how central a documentation file is for onboarding, from 1 to 10. */
final class FileImportanceScorer {
  private FileImportanceScorer() {}

  static final int MAX_SCORE = 10;

  static final RuleTable<Integer> NAME_BONUS =
      RuleTable.<Integer>builder()
          .whenContains("readme", 5)
          .whenContainsAll(4, "getting", "started")
          .whenContainsAny(3, "setup", "install", "guide")
          .whenContainsAny(2, "api", "reference", "docs")
          .build();

  static int score(String fileName, MarkdownDocument document) {
    int importance = 1 + NAME_BONUS.lookup(fileName.toLowerCase(Locale.ROOT), 0);

    int length = document.content().length();
    if (length > 2000) {
      importance += 2;
    } else if (length > 1000) {
      importance += 1;
    }

    int blocks = document.fencedBlocks().size();
    if (blocks > 3) {
      importance += 2;
    } else if (blocks > 0) {
      importance += 1;
    }

    if (document.sections().size() > 5) {
      importance += 1;
    }
    return Math.min(importance, MAX_SCORE);
  }
}
