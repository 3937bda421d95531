package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Set;

/**
 * A named idea extracted from a documentation heading that explains project structure or intent.
 *
 * <p>Instances are immutable; merging two concepts produces a new instance (see {@code
 * ConceptMerger}). Both sets are kept sorted so serialized output is stable.
 *
 * @param name heading text, non-empty
 * @param description first paragraph of the section, at most ~200 chars
 * @param importance 1 to 10
 * @param relatedFiles files in which the concept is defined
 * @param prerequisites free-text prerequisite phrases mined from the section
 */
public record Concept(
    String name,
    String description,
    int importance,
    @JsonProperty("related_files") Set<String> relatedFiles,
    Set<String> prerequisites) {

  public static final int MIN_IMPORTANCE = 1;
  public static final int MAX_IMPORTANCE = 10;

  public Concept {
    Validation.requireText(name, "name");
    Validation.requireText(description, "description");
    Validation.requireRange(importance, MIN_IMPORTANCE, MAX_IMPORTANCE, "importance");
    relatedFiles = Validation.copySortedSet(relatedFiles, "related_files");
    prerequisites = Validation.copySortedSet(prerequisites, "prerequisites");
  }

  /** Identity used for deduplication: lower-cased, trimmed name. */
  public String key() {
    return canonicalName(name);
  }

  public static String canonicalName(String name) {
    return name == null ? "" : name.toLowerCase(Locale.ROOT).strip();
  }
}
