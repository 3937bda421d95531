package com.gentoro.specops.markdown;

import java.util.Locale;

/**
 * A closed fenced code block.
 *
 * @param info text after the opening fence, trimmed (may be empty)
 * @param code block content without the fences
 * @param start offset of the opening fence
 */
public record FencedBlock(String info, String code, int start, int end) {

  /** First word of the info string, lower-cased; empty when the fence carries no tag. */
  public String languageTag() {
    if (info == null || info.isBlank()) return "";
    String first = info.trim().split("\\s+", 2)[0];
    // "```python{.numberLines}" style attributes
    int brace = first.indexOf('{');
    if (brace > 0) first = first.substring(0, brace);
    return first.toLowerCase(Locale.ROOT);
  }
}
