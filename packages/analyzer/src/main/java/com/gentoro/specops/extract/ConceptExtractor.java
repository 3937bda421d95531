package com.gentoro.specops.extract;

import com.gentoro.specops.exception.ValidationException;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.markdown.MarkdownPrimitives;
import com.gentoro.specops.markdown.OutlineSection;
import com.gentoro.specops.model.Concept;
import com.gentoro.specops.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns concept-bearing headings ("Overview", "Architecture", "What is X", ...) into {@link
 * Concept}s. The section body is everything up to the next heading of any level.
 */
public class ConceptExtractor implements ContentExtractor<Concept> {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(ConceptExtractor.class);

  public static final String NO_DESCRIPTION = "No description available";
  static final int DESCRIPTION_LIMIT = 200;
  static final int LONG_SECTION = 500;

  private static final RuleTable<String> KEY_TERMS =
      RuleTable.keywords("architecture", "overview", "getting started", "introduction");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

  @Override
  public List<Concept> extract(MarkdownDocument document) {
    List<Concept> concepts = new ArrayList<>();
    for (OutlineSection section : document.sections()) {
      if (!HeadingClassifier.isConcept(section.lowerTitle())) continue;
      String body = section.body();
      try {
        concepts.add(
            new Concept(
                section.title().strip(),
                describe(body),
                importance(section.level(), section.title(), body),
                document.path().isEmpty() ? Set.of() : Set.of(document.path()),
                PrerequisiteExtractor.extract(body)));
      } catch (ValidationException e) {
        log.debug(
            "Dropping concept '{}' from {}: {}",
            section.title(),
            document.path(),
            e.getMessage());
      }
    }
    return concepts;
  }

  /** {@code max(1, 7 - level)}, +2 for a key term in the heading, +1 for a long body; cap 10. */
  static int importance(int level, String heading, String body) {
    int importance = Math.max(1, 7 - level);
    if (KEY_TERMS.anyMatch(heading)) {
      importance = Math.min(Concept.MAX_IMPORTANCE, importance + 2);
    }
    if (body.length() > LONG_SECTION) {
      importance = Math.min(Concept.MAX_IMPORTANCE, importance + 1);
    }
    return importance;
  }

  /** First paragraph with inline markup removed, abbreviated to 200 chars. */
  static String describe(String body) {
    for (String paragraph : PARAGRAPH_BREAK.split(body)) {
      if (paragraph.isBlank()) continue;
      String text = MarkdownPrimitives.stripInlineMarkup(paragraph.strip()).strip();
      if (!text.isEmpty()) {
        return StringUtility.abbreviate(text, DESCRIPTION_LIMIT);
      }
    }
    return NO_DESCRIPTION;
  }
}
