package com.gentoro.specops.extract;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PrerequisiteExtractorTest {

  @Test
  @DisplayName("Requirement phrases are split into items")
  void splitsItems() {
    assertEquals(
        List.of("Python 3.8", "Git", "Docker"),
        List.copyOf(PrerequisiteExtractor.extract("Requirements: Python 3.8, Git and Docker.")));
  }

  @Test
  @DisplayName("Fixed phrases are kept whole")
  void fixedPhrases() {
    assertTrue(
        PrerequisiteExtractor.extract("Before you can start, read this.")
            .contains("Before you can start"));
    assertTrue(
        PrerequisiteExtractor.extract("Make sure you have a key.").contains("Make sure you have"));
  }

  @Test
  @DisplayName("Overlong items and empty input yield nothing")
  void limits() {
    assertTrue(PrerequisiteExtractor.extract("needs: " + "x".repeat(120)).isEmpty());
    assertTrue(PrerequisiteExtractor.extract("").isEmpty());
    assertTrue(PrerequisiteExtractor.extract(null).isEmpty());
  }
}
