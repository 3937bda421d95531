package com.gentoro.specops.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.model.Dependency;
import com.gentoro.specops.model.DependencyType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DependencyExtractorTest {

  private final DependencyExtractor extractor = new DependencyExtractor();

  @Test
  @DisplayName("pip install with a pinned version keeps the comparator")
  void pinnedVersion() {
    List<Dependency> deps = extractor.extract("pip install requests==2.28.0", "README.md");
    assertEquals(1, deps.size());
    Dependency d = deps.get(0);
    assertEquals("requests", d.name());
    assertEquals("==2.28.0", d.version());
    assertEquals(DependencyType.RUNTIME, d.type());
    assertEquals("Dependency found in README.md", d.description());
  }

  @Test
  @DisplayName("Several installers are recognized and flags are not packages")
  void installersAndFlags() {
    String md =
        "Run pip install -r requirements.txt\n"
            + "Then `npm install lodash`.\n"
            + "brew install node\n"
            + "pip install numpy>=1.21\n";
    List<Dependency> deps = extractor.extract(md, "a.md");
    assertEquals(
        List.of("numpy", "lodash", "node"), deps.stream().map(Dependency::name).toList());
    assertEquals(">=1.21", deps.get(0).version());
    assertNull(deps.get(1).version());
  }

  @Test
  @DisplayName("A version range keeps the package and its first clause")
  void versionRange() {
    List<Dependency> deps = extractor.extract("pip install requests>=2.0,<3", "README.md");
    assertEquals(1, deps.size());
    assertEquals("requests", deps.get(0).name());
    assertEquals(">=2.0", deps.get(0).version());
  }

  @Test
  @DisplayName("Unparseable specs are dropped")
  void invalidSpec() {
    assertTrue(DependencyExtractor.parse("==1.0", DependencyType.RUNTIME, "a.md").isEmpty());
    assertTrue(DependencyExtractor.parse("-e", DependencyType.RUNTIME, "a.md").isEmpty());
    assertTrue(DependencyExtractor.parse("x==1 0", DependencyType.RUNTIME, "a.md").isEmpty());
  }
}
