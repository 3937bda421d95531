package com.gentoro.specops.markdown;

import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link MarkdownDocument} with flexmark:
 *
 * <ul>
 *   <li>top-level ATX headings ({@code #} to {@code ######}) become {@link OutlineSection}s whose
 *       body runs until the next heading of any level
 *   <li>closed fenced code blocks anywhere in the tree become {@link FencedBlock}s
 * </ul>
 *
 * Lines starting with {@code #} inside code fences are therefore never mistaken for headings.
 */
public class MarkdownOutlineParser {
  private final Parser parser = Parser.builder().build();

  public MarkdownDocument parse(String path, String content) {
    String md = content == null ? "" : content;
    Node root = parser.parse(md);

    List<Heading> headings = new ArrayList<>();
    Node node = root.getFirstChild();
    while (node != null) {
      if (node instanceof Heading h && h.isAtxHeading()) {
        headings.add(h);
      }
      node = node.getNext();
    }

    List<OutlineSection> sections = new ArrayList<>(headings.size());
    for (int i = 0; i < headings.size(); i++) {
      Heading h = headings.get(i);
      String title = h.getText().toString().trim();
      int bodyStart = Math.min(h.getEndOffset(), md.length());
      int bodyEnd = i + 1 < headings.size() ? headings.get(i + 1).getStartOffset() : md.length();
      if (title.isEmpty()) {
        // a bare "#" still closes the previous section but is not part of the outline
        continue;
      }
      sections.add(
          new OutlineSection(
              h.getLevel(),
              title,
              h.getStartOffset(),
              bodyStart,
              bodyEnd,
              md.substring(bodyStart, Math.max(bodyStart, bodyEnd))));
    }

    List<FencedBlock> blocks = new ArrayList<>();
    for (Node n : root.getDescendants()) {
      if (n instanceof FencedCodeBlock f && !f.getClosingMarker().isEmpty()) {
        blocks.add(
            new FencedBlock(
                f.getInfo().toString().trim(),
                f.getContentChars().toString(),
                f.getStartOffset(),
                f.getEndOffset()));
      }
    }
    return new MarkdownDocument(path, md, sections, blocks);
  }
}
