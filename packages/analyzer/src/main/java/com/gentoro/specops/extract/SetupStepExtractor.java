package com.gentoro.specops.extract;

import com.gentoro.specops.exception.ValidationException;
import com.gentoro.specops.markdown.MarkdownDocument;
import com.gentoro.specops.markdown.OutlineSection;
import com.gentoro.specops.model.SetupStep;
import com.gentoro.specops.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@link SetupStep}s from setup-like sections (install, configuration, requirements,
 * ...).
 *
 * <p>Inside a section, a numbered item, a bullet or a "Step N:" line opens a new step; following
 * lines without a marker extend the open step. A section with content but no marker yields one
 * step built from the heading. Orders count up from the number of steps already taken from the
 * same file, so steps of different files interleave when sorted.
 */
public class SetupStepExtractor implements ContentExtractor<SetupStep> {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(SetupStepExtractor.class);

  static final int TITLE_LIMIT = 50;
  static final int SYNTHESIZED_DESCRIPTION_LIMIT = 200;

  private static final List<Pattern> STEP_MARKERS =
      List.of(
          Pattern.compile("^\\d+\\.\\s+(.+)$"),
          Pattern.compile("^[-*]\\s+(.+)$"),
          Pattern.compile("^Step\\s+\\d+:?\\s+(.+)$", Pattern.CASE_INSENSITIVE));

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");

  @Override
  public List<SetupStep> extract(MarkdownDocument document) {
    List<SetupStep> steps = new ArrayList<>();
    for (OutlineSection section : document.sections()) {
      if (HeadingClassifier.isSetup(section.lowerTitle())) {
        steps.addAll(fromSection(section.title(), section.body(), steps.size(), document.path()));
      }
    }
    return steps;
  }

  List<SetupStep> fromSection(String heading, String body, int startOrder, String path) {
    List<SetupStep> steps = new ArrayList<>();
    Draft current = null;
    int order = startOrder;

    for (String raw : LINE_BREAK.split(body)) {
      String line = raw.strip();
      if (line.isEmpty()) continue;

      Optional<String> marker = markerText(line);
      if (marker.isPresent()) {
        if (current != null) {
          add(steps, current, path);
        }
        String text = marker.get();
        current = new Draft(StringUtility.truncate(text, TITLE_LIMIT), text, order++);
        current.commands.addAll(CommandDetector.detect(text));
      } else if (current != null) {
        current.description.append(' ').append(line);
        current.commands.addAll(CommandDetector.detect(line));
      }
    }

    if (current != null) {
      add(steps, current, path);
    } else if (!body.isBlank()) {
      String text = body.strip();
      Draft only =
          new Draft(
              heading, StringUtility.truncate(text, SYNTHESIZED_DESCRIPTION_LIMIT), startOrder);
      only.commands.addAll(CommandDetector.detect(text));
      add(steps, only, path);
    }
    return steps;
  }

  static Optional<String> markerText(String line) {
    for (Pattern p : STEP_MARKERS) {
      Matcher m = p.matcher(line);
      if (m.matches()) {
        return Optional.of(m.group(1));
      }
    }
    return Optional.empty();
  }

  private static void add(List<SetupStep> steps, Draft draft, String path) {
    try {
      steps.add(draft.build());
    } catch (ValidationException e) {
      log.debug("Dropping setup step '{}' from {}: {}", draft.title, path, e.getMessage());
    }
  }

  /** Mutable while the section is scanned; frozen into a {@link SetupStep} once complete. */
  private static final class Draft {
    private final String title;
    private final StringBuilder description;
    private final Set<String> commands = new LinkedHashSet<>();
    private final int order;

    Draft(String title, String description, int order) {
      this.title = title;
      this.description = new StringBuilder(description);
      this.order = order;
    }

    SetupStep build() {
      return new SetupStep(
          title, description.toString(), new ArrayList<>(commands), List.of(), order);
    }
  }
}
