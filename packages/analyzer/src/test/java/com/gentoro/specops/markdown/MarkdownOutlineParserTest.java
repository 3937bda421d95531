package com.gentoro.specops.markdown;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarkdownOutlineParserTest {

  private final MarkdownOutlineParser parser = new MarkdownOutlineParser();

  @Test
  @DisplayName("Each ATX heading owns the text up to the next heading of any level")
  void sectionsAndBodies() {
    String md =
        "# Title\nintro\n\n## Overview\nbody text\n\n```bash\n# not a heading\necho hi\n```\n"
            + "### Deep\nmore\n";
    MarkdownDocument doc = parser.parse("README.md", md);

    List<OutlineSection> sections = doc.sections();
    assertEquals(3, sections.size());
    assertEquals("Title", sections.get(0).title());
    assertEquals(1, sections.get(0).level());
    assertEquals("Overview", sections.get(1).title());
    assertEquals(2, sections.get(1).level());
    assertTrue(sections.get(1).body().contains("echo hi"));
    assertFalse(sections.get(1).body().contains("more"));
    assertEquals("Deep", sections.get(2).title());
    assertEquals("more", sections.get(2).body().strip());
    assertEquals("overview", sections.get(1).lowerTitle());
  }

  @Test
  @DisplayName("Closed fences become blocks; hash lines inside them are not headings")
  void fencedBlocks() {
    String md = "# A\n```python\n# comment\nprint(1)\n```\n";
    MarkdownDocument doc = parser.parse("a.md", md);

    assertEquals(1, doc.sections().size());
    assertEquals(1, doc.fencedBlocks().size());
    FencedBlock block = doc.fencedBlocks().get(0);
    assertEquals("python", block.languageTag());
    assertEquals("# comment\nprint(1)\n", block.code());
    assertEquals(md.indexOf("```"), block.start());
    assertTrue(doc.hasCodeBlocks());
  }

  @Test
  @DisplayName("An unclosed fence yields no code block")
  void unclosedFence() {
    MarkdownDocument doc = parser.parse("a.md", "# A\n```python\nprint(1)\n");
    assertTrue(doc.fencedBlocks().isEmpty());
    assertFalse(doc.hasCodeBlocks());
  }

  @Test
  @DisplayName("Setext headings and blank ATX headings are not part of the outline")
  void ignoredHeadings() {
    MarkdownDocument doc = parser.parse("a.md", "Title\n=====\n\n#\n\n## Real\ntext\n");
    assertEquals(1, doc.sections().size());
    assertEquals("Real", doc.sections().get(0).title());
  }

  @Test
  @DisplayName("Null content parses to an empty document")
  void nullContent() {
    MarkdownDocument doc = MarkdownDocument.parse(null, null);
    assertEquals("", doc.path());
    assertEquals("", doc.content());
    assertTrue(doc.sections().isEmpty());
  }

  @Test
  @DisplayName("Language tag takes the first info word without attributes")
  void languageTag() {
    assertEquals("python", new FencedBlock("Python{.numberLines}", "x", 0, 1).languageTag());
    assertEquals("js", new FencedBlock("js title=app.js", "x", 0, 1).languageTag());
    assertEquals("", new FencedBlock("", "x", 0, 1).languageTag());
  }
}
