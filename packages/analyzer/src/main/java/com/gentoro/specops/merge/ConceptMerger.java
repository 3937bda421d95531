package com.gentoro.specops.merge;

import com.gentoro.specops.model.Concept;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Collapses concepts that share a canonical (lower-cased, trimmed) name. */
public final class ConceptMerger {
  private ConceptMerger() {}

  /**
   * Combine two records of the same concept into a new one: file and prerequisite sets are
   * unioned, the longer description wins (the incumbent's on a tie) and the higher importance is
   * kept. Neither input is modified.
   */
  public static Concept merge(Concept incumbent, Concept newcomer) {
    Set<String> files = new TreeSet<>(incumbent.relatedFiles());
    files.addAll(newcomer.relatedFiles());
    Set<String> prerequisites = new TreeSet<>(incumbent.prerequisites());
    prerequisites.addAll(newcomer.prerequisites());
    String description =
        newcomer.description().length() > incumbent.description().length()
            ? newcomer.description()
            : incumbent.description();
    return new Concept(
        incumbent.name(),
        description,
        Math.max(incumbent.importance(), newcomer.importance()),
        files,
        prerequisites);
  }

  /** One concept per canonical name, most important first; ties keep first-seen order. */
  public static List<Concept> deduplicate(List<Concept> concepts) {
    Map<String, Concept> byKey = new LinkedHashMap<>();
    for (Concept c : concepts) {
      byKey.merge(c.key(), c, ConceptMerger::merge);
    }
    List<Concept> out = new ArrayList<>(byKey.values());
    out.sort(Comparator.comparingInt(Concept::importance).reversed());
    return out;
  }
}
