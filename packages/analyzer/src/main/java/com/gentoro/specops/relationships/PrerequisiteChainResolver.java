package com.gentoro.specops.relationships;

import com.gentoro.specops.extract.PrerequisiteExtractor;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.utility.StringUtility;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves each file's prerequisite phrases to other files (by humanized file stem, e.g. {@code
 * getting-started.md} reads "getting started") and to concepts defined in other files ({@code
 * concept:<name>}). Phrases that resolve to nothing are dropped.
 *
 * <p>Candidates shorter than {@code minMatchLength} are ignored and a candidate must match whole
 * words, so short stems such as "a" or "io" do not resolve every phrase.
 */
class PrerequisiteChainResolver {
  static final String CONCEPT_PREFIX = "concept:";

  private final int minMatchLength;

  PrerequisiteChainResolver(int minMatchLength) {
    this.minMatchLength = minMatchLength;
  }

  Map<String, List<String>> resolve(
      Map<String, String> contentMap, Map<String, List<Concept>> conceptsByFile) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : contentMap.entrySet()) {
      String path = e.getKey();
      Set<String> chain = new LinkedHashSet<>();
      for (String prerequisite : new TreeSet<>(PrerequisiteExtractor.extract(e.getValue()))) {
        matchFile(path, prerequisite, contentMap).ifPresent(chain::add);
        for (Map.Entry<String, List<Concept>> other : conceptsByFile.entrySet()) {
          if (other.getKey().equals(path)) continue;
          for (Concept c : other.getValue()) {
            if (matches(prerequisite, c.name().strip())) {
              chain.add(CONCEPT_PREFIX + c.name());
              break;
            }
          }
        }
      }
      out.put(path, List.copyOf(chain));
    }
    return out;
  }

  private Optional<String> matchFile(
      String path, String prerequisite, Map<String, String> contentMap) {
    for (String other : contentMap.keySet()) {
      if (other.equals(path)) continue;
      if (matches(prerequisite, StringUtility.humanize(stem(other)))) {
        return Optional.of(other);
      }
    }
    return Optional.empty();
  }

  boolean matches(String prerequisite, String candidate) {
    String c = candidate.strip().toLowerCase(Locale.ROOT);
    if (c.length() < minMatchLength) return false;
    return StringUtility.containsWord(prerequisite.toLowerCase(Locale.ROOT), c);
  }

  static String stem(String path) {
    String name = FileDependencyAnalyzer.fileName(path);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
