package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** How one concept connects to files and other concepts across the repository. */
public record ConceptRelationships(
    @JsonProperty("mentions_in_other_files") List<String> mentionsInOtherFiles,
    @JsonProperty("related_concepts") List<String> relatedConcepts,
    @JsonProperty("prerequisite_for") List<String> prerequisiteFor,
    @JsonProperty("depends_on") List<String> dependsOn) {

  public ConceptRelationships {
    mentionsInOtherFiles = List.copyOf(mentionsInOtherFiles);
    relatedConcepts = List.copyOf(relatedConcepts);
    prerequisiteFor = List.copyOf(prerequisiteFor);
    dependsOn = List.copyOf(dependsOn);
  }
}
