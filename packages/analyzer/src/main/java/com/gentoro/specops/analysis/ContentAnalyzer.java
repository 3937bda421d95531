package com.gentoro.specops.analysis;

import com.gentoro.specops.AnalyzerSettings;
import com.gentoro.specops.CancellationToken;
import com.gentoro.specops.ConfigurationProvider;
import com.gentoro.specops.cache.AnalysisCache;
import com.gentoro.specops.cache.CacheKeyGenerator;
import com.gentoro.specops.cache.CacheStats;
import com.gentoro.specops.deps.DependencyFileAnalyzer;
import com.gentoro.specops.discovery.ContentReader;
import com.gentoro.specops.discovery.DiscoveryResult;
import com.gentoro.specops.discovery.FileContentReader;
import com.gentoro.specops.discovery.FileStructureBuilder;
import com.gentoro.specops.discovery.MarkdownFileDiscovery;
import com.gentoro.specops.exception.AnalysisCancelledException;
import com.gentoro.specops.exception.ExceptionUtil;
import com.gentoro.specops.exception.IoException;
import com.gentoro.specops.extract.DocumentExtractor;
import com.gentoro.specops.extract.FileExtraction;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.merge.ConceptMerger;
import com.gentoro.specops.merge.DependencyMerger;
import com.gentoro.specops.merge.SetupStepOrdering;
import com.gentoro.specops.model.CodeExample;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.RelationshipReport;
import com.gentoro.specops.model.RepositoryAnalysis;
import com.gentoro.specops.model.SetupStep;
import com.gentoro.specops.relationships.RelationshipEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine. {@link #analyzeRepository} turns a directory of Markdown into a
 * merged {@link RepositoryAnalysis}; {@link #analyzeContentRelationships} builds the cross-file
 * {@link RelationshipReport}, memoized by a fingerprint of the files' paths and modification
 * times.
 *
 * <p>Per-file extraction runs on a pool sized by {@code analyzer.extraction.parallelism}; results
 * are merged in discovery order, so output does not depend on scheduling. A file that cannot be
 * read is logged and skipped. A missing root yields an empty result.
 */
public class ContentAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(ContentAnalyzer.class);

  static final String RELATIONSHIPS = "relationships";

  private final AnalyzerSettings settings;
  private final ContentReader reader;
  private final MarkdownFileDiscovery discovery;
  private final DocumentExtractor extractor;
  private final DependencyFileAnalyzer manifests;
  private final RelationshipEngine relationships;
  private final AnalysisCache<RelationshipReport> cache;
  private final CacheKeyGenerator keys;

  /** Settings from {@code classpath:application.yaml}, falling back to compiled-in defaults. */
  public ContentAnalyzer() {
    this(new ConfigurationProvider().settings());
  }

  public ContentAnalyzer(AnalyzerSettings settings) {
    this(settings, new FileContentReader(), new AnalysisCache<>());
  }

  public ContentAnalyzer(
      AnalyzerSettings settings,
      ContentReader reader,
      AnalysisCache<RelationshipReport> cache) {
    this.settings = settings;
    this.reader = reader;
    this.discovery = new MarkdownFileDiscovery(settings);
    this.extractor = new DocumentExtractor();
    this.manifests = new DependencyFileAnalyzer(reader);
    this.relationships = new RelationshipEngine(settings, extractor.concepts());
    this.cache = cache;
    this.keys = new CacheKeyGenerator();
  }

  public RepositoryAnalysis analyzeRepository(String root) {
    return analyzeRepository(Path.of(root));
  }

  public RepositoryAnalysis analyzeRepository(Path root) {
    return analyzeRepository(root, CancellationToken.create());
  }

  public RepositoryAnalysis analyzeRepository(Path root, CancellationToken token) {
    DiscoveryResult found = discovery.discover(root);
    if (!found.rootExists()) {
      return RepositoryAnalysis.empty();
    }
    List<FileExtraction> extractions = extractAll(found, token);
    token.throwIfCancelled("merge", root);

    List<Concept> concepts = new ArrayList<>();
    List<SetupStep> steps = new ArrayList<>();
    List<CodeExample> examples = new ArrayList<>();
    List<Dependency> dependencies = new ArrayList<>();
    for (FileExtraction e : extractions) {
      concepts.addAll(e.concepts());
      steps.addAll(e.setupSteps());
      examples.addAll(e.codeExamples());
      dependencies.addAll(e.dependencies());
    }
    dependencies.addAll(manifests.analyze(root));

    RepositoryAnalysis analysis =
        new RepositoryAnalysis(
            ConceptMerger.deduplicate(concepts),
            SetupStepOrdering.order(steps),
            examples,
            FileStructureBuilder.build(found.tree()),
            DependencyMerger.deduplicate(dependencies));
    log.info(
        "Analyzed {} files under {}: {} concepts, {} setup steps, {} code examples, {}"
            + " dependencies",
        extractions.size(),
        root,
        analysis.concepts().size(),
        analysis.setupSteps().size(),
        analysis.codeExamples().size(),
        analysis.dependencies().size());
    return analysis;
  }

  public RelationshipReport analyzeContentRelationships(String root) {
    return analyzeContentRelationships(Path.of(root));
  }

  public RelationshipReport analyzeContentRelationships(Path root) {
    return analyzeContentRelationships(root, CancellationToken.create());
  }

  public RelationshipReport analyzeContentRelationships(Path root, CancellationToken token) {
    DiscoveryResult found = discovery.discover(root);
    if (!found.rootExists()) {
      return RelationshipReport.empty();
    }
    String key = keys.generate(RELATIONSHIPS, root, found.files());
    return cache.getOrCompute(key, () -> relationships.analyze(readAll(found, token), token));
  }

  public void clearCache() {
    cache.clear();
    log.debug("Relationship cache cleared");
  }

  public CacheStats cacheStats() {
    return cache.stats();
  }

  public AnalyzerSettings settings() {
    return settings;
  }

  private Map<String, String> readAll(DiscoveryResult found, CancellationToken token) {
    Map<String, String> contentMap = new LinkedHashMap<>();
    for (Path file : found.files()) {
      String rel = found.relativePath(file);
      token.throwIfCancelled("reading", rel);
      read(file)
          .filter(content -> !content.isBlank())
          .ifPresent(content -> contentMap.put(rel, content));
    }
    return contentMap;
  }

  private List<FileExtraction> extractAll(DiscoveryResult found, CancellationToken token) {
    List<Path> files = found.files();
    List<FileExtraction> out = new ArrayList<>(files.size());
    int workers = Math.min(settings.parallelism(), files.size());
    if (workers <= 1) {
      for (Path file : files) {
        extractGuarded(found, file, token).ifPresent(out::add);
      }
      return out;
    }

    ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerFactory());
    try {
      List<Future<Optional<FileExtraction>>> futures = new ArrayList<>(files.size());
      for (Path file : files) {
        futures.add(pool.submit(() -> extractGuarded(found, file, token)));
      }
      for (Future<Optional<FileExtraction>> f : futures) {
        await(f).ifPresent(out::add);
      }
      return out;
    } finally {
      pool.shutdownNow();
    }
  }

  private Optional<FileExtraction> await(Future<Optional<FileExtraction>> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalysisCancelledException(
          "Interrupted while waiting for extraction", Map.of("stage", "extraction"));
    } catch (ExecutionException e) {
      if (e.getCause() instanceof AnalysisCancelledException cancelled) {
        throw cancelled;
      }
      log.warn(
          "Extraction worker failed: {} at {}",
          ExceptionUtil.toErrorDetails(e.getCause()),
          ExceptionUtil.formatCompactStackTrace(e.getCause()));
      return Optional.empty();
    }
  }

  /** A failure in one file drops that file; only cancellation escapes. */
  private Optional<FileExtraction> extractGuarded(
      DiscoveryResult found, Path file, CancellationToken token) {
    try {
      return extractOne(found, file, token);
    } catch (AnalysisCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      logSkipped(found.relativePath(file), e);
      return Optional.empty();
    }
  }

  private Optional<FileExtraction> extractOne(
      DiscoveryResult found, Path file, CancellationToken token) {
    String rel = found.relativePath(file);
    token.throwIfCancelled("extraction", rel);
    return read(file).map(content -> extractor.extract(MarkdownDocument.parse(rel, content)));
  }

  private Optional<String> read(Path file) {
    try {
      return Optional.of(reader.read(file));
    } catch (IoException e) {
      log.warn("Skipping {}: {}", file, e.getMessage());
      return Optional.empty();
    } catch (AnalysisCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      logSkipped(file.toString(), e);
      return Optional.empty();
    }
  }

  private static void logSkipped(String file, RuntimeException e) {
    log.warn(
        "Skipping {}: {} at {}",
        file,
        ExceptionUtil.toErrorDetails(e),
        ExceptionUtil.formatCompactStackTrace(e));
  }

  private static final class WorkerFactory implements java.util.concurrent.ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "content-extract-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
