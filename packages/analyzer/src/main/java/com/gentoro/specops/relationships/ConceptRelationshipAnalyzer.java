package com.gentoro.specops.relationships;

import com.gentoro.specops.model.Concept;
import com.gentoro.specops.model.ConceptRelationships;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups concepts by canonical name across files and relates them:
 *
 * <ul>
 *   <li>{@code mentions_in_other_files}: files that do not define the concept but name it
 *   <li>{@code related_concepts}: other concepts named anywhere in a defining file
 *   <li>{@code depends_on}: other concepts named right after a dependency phrase ("requires",
 *       "depends on", ...) up to the end of the sentence, in a defining file
 *   <li>{@code prerequisite_for}: the inverse of {@code depends_on}
 * </ul>
 */
class ConceptRelationshipAnalyzer {

  static final List<String> DEPENDENCY_KEYWORDS =
      List.of("depends on", "requires", "needs", "prerequisite", "before", "after", "following");

  private static final List<Pattern> DEPENDENCY_WINDOWS = compileWindows();

  private static List<Pattern> compileWindows() {
    List<Pattern> out = new ArrayList<>();
    for (String keyword : DEPENDENCY_KEYWORDS) {
      out.add(
          Pattern.compile(
              "\\b" + Pattern.quote(keyword) + "\\s+([^.!?\\n]+)", Pattern.CASE_INSENSITIVE));
    }
    return out;
  }

  private static final class Group {
    final String name;
    final String lowerName;
    final Set<String> definingFiles = new LinkedHashSet<>();

    Group(String name) {
      this.name = name;
      this.lowerName = name.toLowerCase(Locale.ROOT);
    }
  }

  Map<String, ConceptRelationships> analyze(
      Map<String, String> contentMap, Map<String, List<Concept>> conceptsByFile) {
    Map<String, Group> groups = new LinkedHashMap<>();
    for (Map.Entry<String, List<Concept>> e : conceptsByFile.entrySet()) {
      for (Concept c : e.getValue()) {
        groups.computeIfAbsent(c.key(), k -> new Group(c.name())).definingFiles.add(e.getKey());
      }
    }

    Map<String, String> lowerContent = new LinkedHashMap<>();
    contentMap.forEach((path, content) -> lowerContent.put(path, content.toLowerCase(Locale.ROOT)));

    Map<String, Set<String>> mentions = new LinkedHashMap<>();
    Map<String, Set<String>> related = new LinkedHashMap<>();
    Map<String, Set<String>> dependsOn = new LinkedHashMap<>();
    Map<String, Set<String>> prerequisiteFor = new LinkedHashMap<>();

    for (Group g : groups.values()) {
      Set<String> m = new LinkedHashSet<>();
      for (Map.Entry<String, String> e : lowerContent.entrySet()) {
        if (!g.definingFiles.contains(e.getKey()) && e.getValue().contains(g.lowerName)) {
          m.add(e.getKey());
        }
      }

      Set<String> r = new LinkedHashSet<>();
      Set<String> d = new LinkedHashSet<>();
      for (String file : g.definingFiles) {
        String lower = lowerContent.getOrDefault(file, "");
        for (Group other : groups.values()) {
          if (other != g && lower.contains(other.lowerName)) {
            r.add(other.name);
          }
        }
        for (String window : dependencyWindows(contentMap.getOrDefault(file, ""))) {
          for (Group other : groups.values()) {
            if (other != g && window.contains(other.lowerName)) {
              d.add(other.name);
            }
          }
        }
      }
      mentions.put(g.name, m);
      related.put(g.name, r);
      dependsOn.put(g.name, d);
      prerequisiteFor.put(g.name, new LinkedHashSet<>());
    }

    dependsOn.forEach(
        (name, deps) -> deps.forEach(dep -> prerequisiteFor.get(dep).add(name)));

    Map<String, ConceptRelationships> out = new LinkedHashMap<>();
    for (Group g : groups.values()) {
      out.put(
          g.name,
          new ConceptRelationships(
              List.copyOf(mentions.get(g.name)),
              List.copyOf(related.get(g.name)),
              List.copyOf(prerequisiteFor.get(g.name)),
              List.copyOf(dependsOn.get(g.name))));
    }
    return out;
  }

  /** Lower-cased text following each dependency phrase, cut at the end of the sentence. */
  static List<String> dependencyWindows(String content) {
    List<String> windows = new ArrayList<>();
    for (Pattern p : DEPENDENCY_WINDOWS) {
      Matcher m = p.matcher(content);
      while (m.find()) {
        windows.add(m.group(1).toLowerCase(Locale.ROOT));
      }
    }
    return windows;
  }
}
