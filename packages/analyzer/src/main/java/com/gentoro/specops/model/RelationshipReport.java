package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.specops.utility.JacksonUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-file view of a repository's documentation. Every map is keyed by the file's path
 * relative to the repository root (forward slashes), except {@code concept_relationships} which
 * is keyed by concept name. Maps keep discovery order.
 */
public record RelationshipReport(
    @JsonProperty("file_dependencies") Map<String, List<String>> fileDependencies,
    @JsonProperty("concept_relationships")
        Map<String, ConceptRelationships> conceptRelationships,
    @JsonProperty("content_hierarchy") Map<String, FileOutline> contentHierarchy,
    @JsonProperty("cross_references") Map<String, List<CrossReference>> crossReferences,
    @JsonProperty("prerequisite_chains") Map<String, List<String>> prerequisiteChains) {

  public RelationshipReport {
    fileDependencies = freeze(fileDependencies);
    conceptRelationships = freeze(conceptRelationships);
    contentHierarchy = freeze(contentHierarchy);
    crossReferences = freeze(crossReferences);
    prerequisiteChains = freeze(prerequisiteChains);
  }

  public static RelationshipReport empty() {
    return new RelationshipReport(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
  }

  public String toJson() {
    return JacksonUtility.toJson(this);
  }

  private static <V> Map<String, V> freeze(Map<String, V> in) {
    if (in == null || in.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }
}
