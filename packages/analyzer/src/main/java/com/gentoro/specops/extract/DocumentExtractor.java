package com.gentoro.specops.extract;

import com.gentoro.specops.markdown.MarkdownDocument;

/** Runs the four extractors over one parsed document. Stateless and thread-safe. */
public class DocumentExtractor {
  private final ConceptExtractor concepts;
  private final SetupStepExtractor setupSteps;
  private final CodeExampleExtractor codeExamples;
  private final DependencyExtractor dependencies;

  public DocumentExtractor() {
    this(
        new ConceptExtractor(),
        new SetupStepExtractor(),
        new CodeExampleExtractor(),
        new DependencyExtractor());
  }

  public DocumentExtractor(
      ConceptExtractor concepts,
      SetupStepExtractor setupSteps,
      CodeExampleExtractor codeExamples,
      DependencyExtractor dependencies) {
    this.concepts = concepts;
    this.setupSteps = setupSteps;
    this.codeExamples = codeExamples;
    this.dependencies = dependencies;
  }

  public FileExtraction extract(MarkdownDocument document) {
    return new FileExtraction(
        document.path(),
        concepts.extract(document),
        setupSteps.extract(document),
        codeExamples.extract(document),
        dependencies.extract(document));
  }

  public ConceptExtractor concepts() {
    return concepts;
  }
}
