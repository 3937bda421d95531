package com.gentoro.specops.analysis;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.specops.AnalyzerSettings;
import com.gentoro.specops.CancellationToken;
import com.gentoro.specops.cache.AnalysisCache;
import com.gentoro.specops.cache.CacheStats;
import com.gentoro.specops.discovery.ContentReader;
import com.gentoro.specops.discovery.FileContentReader;
import com.gentoro.specops.exception.AnalysisCancelledException;
import com.gentoro.specops.exception.IoException;
import com.gentoro.specops.model.CodeExample;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.RelationshipReport;
import com.gentoro.specops.model.RepositoryAnalysis;
import com.gentoro.specops.model.SetupStep;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ContentAnalyzerTest {

  @TempDir Path root;

  private Path readme;

  @BeforeEach
  void setUp() throws IOException {
    readme = root.resolve("README.md");
    Files.writeString(
        readme,
        "## Overview\n\nThis project rocks.\n\n## Installation\n\n"
            + "1. Run pip install -r requirements.txt");
    Files.createDirectories(root.resolve("docs"));
    Files.writeString(root.resolve("docs/api.md"), "```python\ndef f(): pass\n```");
  }

  private static ContentAnalyzer analyzer(int parallelism) {
    return new ContentAnalyzer(AnalyzerSettings.defaults().withParallelism(parallelism));
  }

  @ParameterizedTest(name = "parallelism={0}")
  @ValueSource(ints = {1, 4})
  @DisplayName("Two-file repository yields one concept, one setup step and one code example")
  void endToEnd(int parallelism) {
    RepositoryAnalysis analysis = analyzer(parallelism).analyzeRepository(root);

    assertEquals(List.of("Overview"), analysis.concepts().stream().map(Concept::name).toList());
    assertEquals(1, analysis.setupSteps().size());
    SetupStep step = analysis.setupSteps().get(0);
    assertTrue(step.commands().contains("pip install -r requirements.txt"));
    assertEquals(1, analysis.codeExamples().size());
    CodeExample example = analysis.codeExamples().get(0);
    assertEquals("python", example.language());
    assertEquals("docs/api.md", example.filePath());
    assertTrue(analysis.dependencies().isEmpty());

    @SuppressWarnings("unchecked")
    Map<String, Object> docs = (Map<String, Object>) analysis.fileStructure().get("docs");
    assertEquals(List.of("api.md"), docs.get(RepositoryAnalysis.FILES_KEY));
  }

  @Test
  @DisplayName("Analyzing an unchanged tree twice gives identical output")
  void idempotent() {
    ContentAnalyzer analyzer = analyzer(4);
    assertEquals(
        analyzer.analyzeRepository(root).toJson(), analyzer.analyzeRepository(root).toJson());
    assertEquals(analyzer.analyzeRepository(root), analyzer(1).analyzeRepository(root.toString()));
  }

  @Test
  @DisplayName("A missing root yields empty results instead of failing")
  void missingRoot() {
    ContentAnalyzer analyzer = analyzer(2);
    assertTrue(analyzer.analyzeRepository(root.resolve("nope")).isEmpty());
    assertEquals(
        RelationshipReport.empty(), analyzer.analyzeContentRelationships(root.resolve("nope")));
    assertEquals(0, analyzer.cacheStats().relationshipCacheSize());
  }

  @Test
  @DisplayName("The no-arg analyzer picks up the bundled application.yaml")
  void bundledConfiguration() {
    assertEquals(4, new ContentAnalyzer().settings().parallelism());
  }

  @Test
  @DisplayName("A cache hit reads no files; touching a file recomputes")
  void cacheHitReadsNothing() throws IOException {
    ContentReader reader = spy(new FileContentReader());
    ContentAnalyzer analyzer =
        new ContentAnalyzer(AnalyzerSettings.defaults(), reader, new AnalysisCache<>());

    RelationshipReport first = analyzer.analyzeContentRelationships(root);
    verify(reader, times(2)).read(any());

    clearInvocations(reader);
    RelationshipReport second = analyzer.analyzeContentRelationships(root);
    verify(reader, never()).read(any());
    assertEquals(first, second);

    FileTime mtime = Files.getLastModifiedTime(readme);
    Files.setLastModifiedTime(readme, FileTime.fromMillis(mtime.toMillis() + 10_000));
    analyzer.analyzeContentRelationships(root);
    verify(reader, times(2)).read(any());

    assertEquals(new CacheStats(2, 2, 1), analyzer.cacheStats());
    analyzer.clearCache();
    assertEquals(0, analyzer.cacheStats().relationshipCacheSize());
  }

  @Test
  @DisplayName("An unreadable file is skipped and the rest is analyzed")
  void unreadableFileSkipped() {
    ContentReader failing =
        file -> {
          if (file.getFileName().toString().equals("api.md")) {
            throw new IoException("permission denied");
          }
          return new FileContentReader().read(file);
        };
    ContentAnalyzer analyzer =
        new ContentAnalyzer(
            AnalyzerSettings.defaults().withParallelism(3), failing, new AnalysisCache<>());

    RepositoryAnalysis analysis = analyzer.analyzeRepository(root);
    assertEquals(1, analysis.concepts().size());
    assertTrue(analysis.codeExamples().isEmpty());
    assertEquals(
        List.of("README.md"),
        List.copyOf(analyzer.analyzeContentRelationships(root).contentHierarchy().keySet()));
  }

  @ParameterizedTest(name = "parallelism={0}")
  @ValueSource(ints = {1, 4})
  @DisplayName("An unexpected failure in one file drops that file regardless of worker count")
  void failingFileDropped(int parallelism) throws IOException {
    Files.writeString(root.resolve("bad.md"), "## Overview of bad\n\nNever read.");
    ContentReader failing =
        file -> {
          if (file.getFileName().toString().equals("bad.md")) {
            throw new IllegalStateException("boom");
          }
          return new FileContentReader().read(file);
        };
    ContentAnalyzer analyzer =
        new ContentAnalyzer(
            AnalyzerSettings.defaults().withParallelism(parallelism),
            failing,
            new AnalysisCache<>());

    assertEquals(1, analyzer.analyzeRepository(root).concepts().size());
    assertFalse(
        analyzer.analyzeContentRelationships(root).contentHierarchy().containsKey("bad.md"));
  }

  @Test
  @DisplayName("Empty files are discovered but left out of the relationship report")
  void emptyFileLeftOutOfRelationships() throws IOException {
    Files.writeString(root.resolve("empty.md"), "");
    RelationshipReport report = analyzer(2).analyzeContentRelationships(root);

    assertFalse(report.contentHierarchy().containsKey("empty.md"));
    assertTrue(report.contentHierarchy().containsKey("README.md"));
  }

  @ParameterizedTest(name = "parallelism={0}")
  @ValueSource(ints = {1, 4})
  @DisplayName("A cancelled token aborts both analyses")
  void cancellation(int parallelism) {
    CancellationToken token = CancellationToken.create();
    token.cancel();
    ContentAnalyzer analyzer = analyzer(parallelism);

    assertThrows(
        AnalysisCancelledException.class, () -> analyzer.analyzeRepository(root, token));
    assertThrows(
        AnalysisCancelledException.class,
        () -> analyzer.analyzeContentRelationships(root, token));
    assertEquals(0, analyzer.cacheStats().relationshipCacheSize());
  }

  @Test
  @DisplayName("Manifest dependencies merge after documentation ones")
  void manifestMerge() throws IOException {
    Files.writeString(root.resolve("docs/deps.md"), "Install with `pip install requests`.\n");
    Files.writeString(root.resolve("requirements.txt"), "flask\nrequests>=2.0\n");

    List<Dependency> deps = analyzer(2).analyzeRepository(root).dependencies();
    assertEquals(List.of("requests", "flask"), deps.stream().map(Dependency::name).toList());
    assertEquals(">=2.0", deps.get(0).version());
  }

  @Test
  @DisplayName("Relationship report for the sample repository")
  void relationships() throws IOException {
    Files.writeString(root.resolve("setup.md"), "# Setup\nSee the [readme](README.md).\n");
    RelationshipReport report = analyzer(2).analyzeContentRelationships(root.toString());

    assertEquals(
        List.of("README.md", "setup.md", "docs/api.md"),
        List.copyOf(report.contentHierarchy().keySet()));
    assertEquals(List.of("README.md"), report.fileDependencies().get("setup.md"));
    assertTrue(report.contentHierarchy().get("docs/api.md").hasCodeExamples());
    assertTrue(report.toJson().contains("\"concept_relationships\""));
  }
}
