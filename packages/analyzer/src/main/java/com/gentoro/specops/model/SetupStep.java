package com.gentoro.specops.model;

import java.util.List;

/**
 * An orderable instruction toward getting a project running.
 *
 * @param order non-negative position assigned during extraction, used as the primary sort key
 */
public record SetupStep(
    String title,
    String description,
    List<String> commands,
    List<String> prerequisites,
    int order) {

  public SetupStep {
    Validation.requireText(title, "title");
    Validation.requireText(description, "description");
    commands = Validation.copyStrings(commands, "commands");
    prerequisites = Validation.copyStrings(prerequisites, "prerequisites");
    Validation.requireRange(order, 0, Integer.MAX_VALUE, "order");
  }
}
