package com.gentoro.specops.relationships;

import com.gentoro.specops.AnalyzerSettings;
import com.gentoro.specops.CancellationToken;
import com.gentoro.specops.exception.AnalysisCancelledException;
import com.gentoro.specops.exception.ExceptionUtil;
import com.gentoro.specops.extract.ConceptExtractor;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.model.RelationshipReport;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the cross-file {@link RelationshipReport} from already-loaded file contents. Each file
 * is parsed and its concepts extracted once; the five analyzers share those results.
 */
public class RelationshipEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(RelationshipEngine.class);

  private final ConceptExtractor conceptExtractor;
  private final FileDependencyAnalyzer fileDependencies;
  private final ConceptRelationshipAnalyzer conceptRelationships;
  private final ContentHierarchyBuilder hierarchy;
  private final CrossReferenceFinder crossReferences;
  private final PrerequisiteChainResolver prerequisiteChains;

  public RelationshipEngine(AnalyzerSettings settings, ConceptExtractor conceptExtractor) {
    this.conceptExtractor = conceptExtractor;
    this.fileDependencies = new FileDependencyAnalyzer(settings);
    this.conceptRelationships = new ConceptRelationshipAnalyzer();
    this.hierarchy = new ContentHierarchyBuilder();
    this.crossReferences = new CrossReferenceFinder();
    this.prerequisiteChains =
        new PrerequisiteChainResolver(settings.prerequisiteMinMatchLength());
  }

  /**
   * @param contentMap relative path to file content, in discovery order
   * @param token polled once per file while parsing
   */
  public RelationshipReport analyze(Map<String, String> contentMap, CancellationToken token) {
    Map<String, String> usable = new LinkedHashMap<>();
    Map<String, MarkdownDocument> documents = new LinkedHashMap<>();
    Map<String, List<Concept>> conceptsByFile = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : contentMap.entrySet()) {
      token.throwIfCancelled("relationship analysis", e.getKey());
      try {
        MarkdownDocument doc = MarkdownDocument.parse(e.getKey(), e.getValue());
        List<Concept> concepts = conceptExtractor.extract(doc);
        documents.put(e.getKey(), doc);
        conceptsByFile.put(e.getKey(), concepts);
        usable.put(e.getKey(), e.getValue());
      } catch (AnalysisCancelledException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        log.warn(
            "Leaving {} out of the relationship report: {} at {}",
            e.getKey(),
            ExceptionUtil.toErrorDetails(ex),
            ExceptionUtil.formatCompactStackTrace(ex));
      }
    }
    token.throwIfCancelled("relationship analysis", "aggregation");

    RelationshipReport report =
        new RelationshipReport(
            fileDependencies.analyze(usable),
            conceptRelationships.analyze(usable, conceptsByFile),
            hierarchy.build(documents),
            crossReferences.find(usable),
            prerequisiteChains.resolve(usable, conceptsByFile));
    log.debug(
        "Relationship report built for {} files, {} concepts",
        usable.size(),
        report.conceptRelationships().size());
    return report;
  }
}
