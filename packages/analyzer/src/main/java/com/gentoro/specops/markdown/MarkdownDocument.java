package com.gentoro.specops.markdown;

import java.util.List;

/**
 * One documentation file parsed once into an outline that every extractor reuses.
 *
 * @param path path string reported in extracted records
 * @param content raw file text
 * @param sections ATX headings in source order, each with its body span
 * @param fencedBlocks closed fenced code blocks in source order
 */
public record MarkdownDocument(
    String path, String content, List<OutlineSection> sections, List<FencedBlock> fencedBlocks) {

  private static final MarkdownOutlineParser DEFAULT_PARSER = new MarkdownOutlineParser();

  public MarkdownDocument {
    path = path == null ? "" : path;
    content = content == null ? "" : content;
    sections = List.copyOf(sections);
    fencedBlocks = List.copyOf(fencedBlocks);
  }

  public static MarkdownDocument parse(String path, String content) {
    return DEFAULT_PARSER.parse(path, content);
  }

  public boolean hasCodeBlocks() {
    return !fencedBlocks.isEmpty();
  }
}
