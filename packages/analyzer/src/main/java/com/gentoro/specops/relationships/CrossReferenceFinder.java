package com.gentoro.specops.relationships;

import com.gentoro.specops.markdown.MarkdownPrimitives;
import com.gentoro.specops.model.CrossReference;
import com.gentoro.specops.model.ReferenceType;
import com.gentoro.specops.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects Markdown links and textual pointers ("see X", "refer to X", ...). Links carry the
 * text within 50 chars on either side of the link text; textual references carry their
 * sentence.
 */
class CrossReferenceFinder {
  static final int LINK_CONTEXT_RADIUS = 50;

  Map<String, List<CrossReference>> find(Map<String, String> contentMap) {
    Map<String, List<CrossReference>> out = new LinkedHashMap<>();
    contentMap.forEach((path, content) -> out.put(path, references(content)));
    return out;
  }

  List<CrossReference> references(String content) {
    List<CrossReference> refs = new ArrayList<>();
    for (MarkdownPrimitives.LinkMatch link : MarkdownPrimitives.links(content)) {
      refs.add(
          new CrossReference(
              ReferenceType.LINK,
              link.text(),
              link.target(),
              linkContext(content, link.start() + 1, link.text().length())));
    }
    for (MarkdownPrimitives.ReferenceMatch ref : MarkdownPrimitives.textualReferences(content)) {
      refs.add(
          new CrossReference(
              ReferenceType.TEXTUAL_REFERENCE,
              ref.token(),
              ref.token(),
              sentenceAround(content, ref.start(), ref.token().length())));
    }
    return refs;
  }

  static String linkContext(String content, int textStart, int textLength) {
    int start = Math.max(0, textStart - LINK_CONTEXT_RADIUS);
    int end = Math.min(content.length(), textStart + textLength + LINK_CONTEXT_RADIUS);
    return StringUtility.collapseWhitespace(content.substring(start, end));
  }

  /** The sentence containing {@code [offset, offset + length)}, bounded by . ! or ? */
  static String sentenceAround(String content, int offset, int length) {
    int start = offset;
    while (start > 0 && !isSentenceEnd(content.charAt(start - 1))) {
      start--;
    }
    int end = Math.min(content.length(), offset + length);
    while (end < content.length() && !isSentenceEnd(content.charAt(end))) {
      end++;
    }
    return content.substring(start, end).strip();
  }

  private static boolean isSentenceEnd(char c) {
    return c == '.' || c == '!' || c == '?';
  }
}
