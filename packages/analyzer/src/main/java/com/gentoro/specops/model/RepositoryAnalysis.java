package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.specops.utility.JacksonUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of {@code ContentAnalyzer#analyzeRepository}: deduplicated concepts (most
 * important first), ordered setup steps, code examples in discovery order, deduplicated
 * dependencies and the nested file tree ({@code directory -> sub-map}, files under {@code
 * _files}).
 */
public record RepositoryAnalysis(
    List<Concept> concepts,
    @JsonProperty("setup_steps") List<SetupStep> setupSteps,
    @JsonProperty("code_examples") List<CodeExample> codeExamples,
    @JsonProperty("file_structure") Map<String, Object> fileStructure,
    List<Dependency> dependencies) {

  public static final String FILES_KEY = "_files";

  public RepositoryAnalysis {
    concepts = concepts == null ? List.of() : List.copyOf(concepts);
    setupSteps = setupSteps == null ? List.of() : List.copyOf(setupSteps);
    codeExamples = codeExamples == null ? List.of() : List.copyOf(codeExamples);
    fileStructure =
        fileStructure == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fileStructure));
    dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
  }

  public static RepositoryAnalysis empty() {
    return new RepositoryAnalysis(List.of(), List.of(), List.of(), Map.of(), List.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return concepts.isEmpty()
        && setupSteps.isEmpty()
        && codeExamples.isEmpty()
        && dependencies.isEmpty();
  }

  public String toJson() {
    return JacksonUtility.toJson(this);
  }
}
