package com.gentoro.specops;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.exception.ConfigException;
import com.gentoro.specops.exception.SpecOpsErrorCode;
import java.io.StringReader;
import java.util.Set;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalyzerSettingsTest {

  private static YAMLConfiguration yaml(String content) throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(new StringReader(content));
    return config;
  }

  @Test
  @DisplayName("Reads analyzer keys, normalizing extensions and extending the skip set")
  void fromConfiguration() throws Exception {
    AnalyzerSettings settings =
        AnalyzerSettings.from(
            yaml(
                "analyzer:\n"
                    + "  discovery:\n"
                    + "    extensions: [MD, .txt]\n"
                    + "    skipDirectories: [build]\n"
                    + "    maxDepth: 5\n"
                    + "  extraction:\n"
                    + "    parallelism: 2\n"
                    + "  prerequisites:\n"
                    + "    minMatchLength: 4\n"));

    assertEquals(Set.of(".md", ".txt"), settings.extensions());
    assertTrue(settings.skipDirectories().contains("build"));
    assertTrue(settings.skipDirectories().contains(".git"));
    assertEquals(5, settings.maxDepth());
    assertEquals(2, settings.parallelism());
    assertEquals(4, settings.prerequisiteMinMatchLength());
    assertTrue(settings.isMarkdown("notes.TXT"));
    assertFalse(settings.isMarkdown("guide.markdown"));
  }

  @Test
  @DisplayName("Missing keys fall back to defaults")
  void defaults() throws Exception {
    AnalyzerSettings settings = AnalyzerSettings.from(yaml("other: 1\n"));
    assertEquals(AnalyzerSettings.DEFAULT_EXTENSIONS, settings.extensions());
    assertEquals(AnalyzerSettings.DEFAULT_SKIP_DIRECTORIES, settings.skipDirectories());
    assertEquals(AnalyzerSettings.DEFAULT_MAX_DEPTH, settings.maxDepth());
    assertTrue(settings.parallelism() >= 1);
    assertTrue(AnalyzerSettings.defaults().isMarkdown("README.MD"));
    assertEquals(AnalyzerSettings.defaults().maxDepth(), AnalyzerSettings.from(null).maxDepth());
  }

  @Test
  @DisplayName("Invalid values are configuration errors")
  void invalidValues() throws Exception {
    ConfigException e =
        assertThrows(
            ConfigException.class,
            () -> AnalyzerSettings.from(yaml("analyzer:\n  extraction:\n    parallelism: 0\n")));
    assertEquals(SpecOpsErrorCode.CONFIGURATION_ERROR, e.getCode());
    assertThrows(ConfigException.class, () -> AnalyzerSettings.defaults().withMaxDepth(0));
  }
}
