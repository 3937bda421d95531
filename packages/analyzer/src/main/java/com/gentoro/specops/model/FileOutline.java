package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Content-hierarchy entry for a single documentation file. */
public record FileOutline(
    List<HeadingEntry> headings,
    int importance,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("has_code_examples") boolean hasCodeExamples) {

  public FileOutline {
    headings = List.copyOf(headings);
  }
}
