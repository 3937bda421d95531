package com.gentoro.specops.markdown;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarkdownPrimitivesTest {

  @Test
  @DisplayName("Finds inline links with their offsets")
  void links() {
    String md = "See [Setup](setup.md) and [API](docs/api.md#auth).";
    List<MarkdownPrimitives.LinkMatch> links = MarkdownPrimitives.links(md);

    assertEquals(2, links.size());
    assertEquals("Setup", links.get(0).text());
    assertEquals("setup.md", links.get(0).target());
    assertEquals(md.indexOf("[Setup]"), links.get(0).start());
    assertEquals("docs/api.md#auth", links.get(1).target());
  }

  @Test
  @DisplayName("Textual references need a word boundary before the verb")
  void textualReferences() {
    String md = "Thread pools are neat. See CONTRIBUTING for more. Please refer to docs/setup.";
    List<MarkdownPrimitives.ReferenceMatch> refs = MarkdownPrimitives.textualReferences(md);

    assertEquals(2, refs.size());
    assertEquals("CONTRIBUTING", refs.get(0).token());
    assertEquals(md.indexOf("CONTRIBUTING"), refs.get(0).start());
    assertEquals("docs/setup", refs.get(1).token());
  }

  @Test
  @DisplayName("Heading lines parse level and title")
  void headingLine() {
    MarkdownPrimitives.HeadingLine h = MarkdownPrimitives.headingLine("### Usage  ").orElseThrow();
    assertEquals(3, h.level());
    assertEquals("Usage", h.title());
    assertTrue(MarkdownPrimitives.headingLine("#hashtag").isEmpty());
    assertTrue(MarkdownPrimitives.headingLine("####### seven").isEmpty());
  }

  @Test
  @DisplayName("Inline markup is stripped and links keep their text")
  void stripInlineMarkup() {
    assertEquals(
        "bold and link and code",
        MarkdownPrimitives.stripInlineMarkup("**bold** and [link](x.md) and `code`"));
    assertTrue(MarkdownPrimitives.isFenceLine("```java"));
    assertTrue(MarkdownPrimitives.isFenceLine("~~~"));
    assertFalse(MarkdownPrimitives.isFenceLine("``inline``x"));
  }
}
