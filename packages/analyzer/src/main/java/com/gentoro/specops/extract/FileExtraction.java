package com.gentoro.specops.extract;

import com.gentoro.specops.model.CodeExample;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.SetupStep;
import java.util.List;

/** Everything the extractors produced for a single file, before cross-file merging. */
public record FileExtraction(
    String path,
    List<Concept> concepts,
    List<SetupStep> setupSteps,
    List<CodeExample> codeExamples,
    List<Dependency> dependencies) {

  public FileExtraction {
    concepts = List.copyOf(concepts);
    setupSteps = List.copyOf(setupSteps);
    codeExamples = List.copyOf(codeExamples);
    dependencies = List.copyOf(dependencies);
  }

  public static FileExtraction empty(String path) {
    return new FileExtraction(path, List.of(), List.of(), List.of(), List.of());
  }
}
