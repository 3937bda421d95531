package com.gentoro.specops.extract;

import com.gentoro.specops.exception.ValidationException;
import com.gentoro.specops.markdown.FencedBlock;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.markdown.MarkdownPrimitives;
import com.gentoro.specops.model.CodeExample;
import com.gentoro.specops.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One {@link CodeExample} per fenced block. Title and description come from the text just above
 * the opening fence: the nearest heading gives the title, the nearest short prose line gives the
 * description (and a title when no heading was reached first).
 */
public class CodeExampleExtractor implements ContentExtractor<CodeExample> {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(CodeExampleExtractor.class);

  public static final String DEFAULT_TITLE = "Code Example";
  public static final String DEFAULT_DESCRIPTION = "Code example from documentation";
  static final int SHORT_LINE = 100;
  static final int TITLE_LIMIT = 50;

  record Context(String title, String description) {}

  @Override
  public List<CodeExample> extract(MarkdownDocument document) {
    List<CodeExample> examples = new ArrayList<>();
    for (FencedBlock block : document.fencedBlocks()) {
      String code = block.code();
      if (code.isBlank()) continue;

      String language = block.languageTag();
      if (language.isEmpty()) {
        language = LanguageDetector.detect(code);
      }
      Context ctx = contextBefore(document.content(), block.start());
      try {
        examples.add(
            new CodeExample(
                ctx.title(),
                code.strip(),
                language.toLowerCase(Locale.ROOT),
                ctx.description(),
                document.path()));
      } catch (ValidationException e) {
        log.debug(
            "Dropping code example at offset {} in {}: {}",
            block.start(),
            document.path(),
            e.getMessage());
      }
    }
    return examples;
  }

  static Context contextBefore(String content, int offset) {
    String before = content.substring(0, Math.max(0, Math.min(offset, content.length())));
    String[] lines = before.split("\\R", -1);
    for (int i = lines.length - 1; i >= 0; i--) {
      String line = lines[i].strip();
      if (line.isEmpty()) continue;

      Optional<MarkdownPrimitives.HeadingLine> heading = MarkdownPrimitives.headingLine(line);
      if (heading.isPresent()) {
        return new Context(heading.get().title(), DEFAULT_DESCRIPTION);
      }
      if (line.length() < SHORT_LINE && !MarkdownPrimitives.isFenceLine(line)) {
        return new Context(StringUtility.truncate(line, TITLE_LIMIT), line);
      }
    }
    return new Context(DEFAULT_TITLE, DEFAULT_DESCRIPTION);
  }
}
