package com.gentoro.specops.markdown;

import java.util.Locale;

/**
 * A heading and the span of source text it owns: everything after the heading line up to the
 * next heading of any level (or end of file).
 *
 * @param headingStart offset of the first {@code #}
 * @param bodyStart offset just past the heading
 * @param bodyEnd exclusive end of the section body
 * @param body {@code content.substring(bodyStart, bodyEnd)}
 */
public record OutlineSection(
    int level, String title, int headingStart, int bodyStart, int bodyEnd, String body) {

  public String lowerTitle() {
    return title.toLowerCase(Locale.ROOT);
  }
}
