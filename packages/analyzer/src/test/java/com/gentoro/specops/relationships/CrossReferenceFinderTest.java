package com.gentoro.specops.relationships;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.model.CrossReference;
import com.gentoro.specops.model.ReferenceType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CrossReferenceFinderTest {

  private final CrossReferenceFinder finder = new CrossReferenceFinder();

  @Test
  @DisplayName("Links carry surrounding text; textual references carry their sentence")
  void linksAndTextualReferences() {
    String md = "Intro text. Please see CONTRIBUTING for rules! Also [Guide](guide.md) here.";
    List<CrossReference> refs = finder.references(md);

    assertEquals(2, refs.size());
    CrossReference link = refs.get(0);
    assertEquals(ReferenceType.LINK, link.type());
    assertEquals("Guide", link.text());
    assertEquals("guide.md", link.target());
    assertTrue(link.context().contains("Also [Guide](guide.md) here."));

    CrossReference textual = refs.get(1);
    assertEquals(ReferenceType.TEXTUAL_REFERENCE, textual.type());
    assertEquals("CONTRIBUTING", textual.text());
    assertEquals("CONTRIBUTING", textual.target());
    assertEquals("Please see CONTRIBUTING for rules", textual.context());
  }

  @Test
  @DisplayName("Link context is limited to 50 characters each side, whitespace collapsed")
  void linkContextWindow() {
    String md = "a".repeat(80) + " [x](y.md)\n\n   " + "b".repeat(80);
    String context = finder.references(md).get(0).context();
    assertEquals("a".repeat(48) + " [x](y.md) " + "b".repeat(38), context);
  }
}
