package com.gentoro.specops.merge;

import com.gentoro.specops.extract.RuleTable;
import com.gentoro.specops.model.SetupStep;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders setup steps by {@code (order, keyword priority)}. The priority comes from the first
 * keyword of the table found in the step title, so an "install" step sorts before a "test" step
 * holding the same order.
 */
public final class SetupStepOrdering {
  private SetupStepOrdering() {}

  public static final int DEFAULT_PRIORITY = 10;

  static final RuleTable<Integer> KEYWORD_PRIORITY =
      RuleTable.<Integer>builder()
          .whenContains("install", 1)
          .whenContains("download", 2)
          .whenContains("setup", 3)
          .whenContains("configure", 4)
          .whenContains("run", 5)
          .whenContains("test", 6)
          .build();

  public static final Comparator<SetupStep> ORDER =
      Comparator.comparingInt(SetupStep::order).thenComparingInt(SetupStepOrdering::priority);

  public static int priority(SetupStep step) {
    return KEYWORD_PRIORITY.lookup(step.title(), DEFAULT_PRIORITY);
  }

  /** Stable: steps equal on both keys keep their input order. */
  public static List<SetupStep> order(List<SetupStep> steps) {
    List<SetupStep> out = new ArrayList<>(steps);
    out.sort(ORDER);
    return out;
  }
}
