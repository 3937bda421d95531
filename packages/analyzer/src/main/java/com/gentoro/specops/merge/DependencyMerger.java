package com.gentoro.specops.merge;

import com.gentoro.specops.model.Dependency;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Collapses dependencies that share a canonical (lower-cased, trimmed) name. */
public final class DependencyMerger {
  private DependencyMerger() {}

  /** The incumbent wins unless it has no version and the newcomer has one. */
  public static Dependency merge(Dependency incumbent, Dependency newcomer) {
    if (!incumbent.hasVersion() && newcomer.hasVersion()) {
      return newcomer;
    }
    return incumbent;
  }

  /** First-seen order is kept, also when a later record replaces an earlier one. */
  public static List<Dependency> deduplicate(List<Dependency> dependencies) {
    Map<String, Dependency> byKey = new LinkedHashMap<>();
    for (Dependency d : dependencies) {
      byKey.merge(d.key(), d, DependencyMerger::merge);
    }
    return new ArrayList<>(byKey.values());
  }
}
