package com.gentoro.specops.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Stateless regex matchers for the inline parts of Markdown the outline parser does not cover. */
public final class MarkdownPrimitives {
  private MarkdownPrimitives() {}

  public static final Pattern HEADING_LINE = Pattern.compile("^(#{1,6})\\s+(.+)$");
  public static final Pattern INLINE_LINK = Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)");
  public static final Pattern TEXTUAL_REFERENCE =
      Pattern.compile(
          "\\b(?:see|refer to|check|read|visit)\\s+([^\\s.]+)", Pattern.CASE_INSENSITIVE);

  private static final Pattern EMPHASIS_CHARS = Pattern.compile("[*_`]");

  public record LinkMatch(String text, String target, int start) {}

  public record ReferenceMatch(String token, int start) {}

  public record HeadingLine(int level, String title) {}

  /** All {@code [text](target)} links, in source order. */
  public static List<LinkMatch> links(String content) {
    List<LinkMatch> out = new ArrayList<>();
    if (content == null) return out;
    Matcher m = INLINE_LINK.matcher(content);
    while (m.find()) {
      out.add(new LinkMatch(m.group(1), m.group(2).trim(), m.start()));
    }
    return out;
  }

  /** Phrases such as "see CONTRIBUTING" or "refer to docs/setup", in source order. */
  public static List<ReferenceMatch> textualReferences(String content) {
    List<ReferenceMatch> out = new ArrayList<>();
    if (content == null) return out;
    Matcher m = TEXTUAL_REFERENCE.matcher(content);
    while (m.find()) {
      out.add(new ReferenceMatch(m.group(1), m.start(1)));
    }
    return out;
  }

  /** Parses a single (already trimmed) line as an ATX heading. */
  public static Optional<HeadingLine> headingLine(String line) {
    if (line == null) return Optional.empty();
    Matcher m = HEADING_LINE.matcher(line);
    if (!m.matches()) return Optional.empty();
    return Optional.of(new HeadingLine(m.group(1).length(), m.group(2).trim()));
  }

  public static boolean isFenceLine(String trimmedLine) {
    return trimmedLine.startsWith("```") || trimmedLine.startsWith("~~~");
  }

  /** Drops emphasis/code markers and replaces links with their text. */
  public static String stripInlineMarkup(String text) {
    if (text == null) return "";
    String stripped = EMPHASIS_CHARS.matcher(text).replaceAll("");
    return INLINE_LINK.matcher(stripped).replaceAll("$1");
  }
}
