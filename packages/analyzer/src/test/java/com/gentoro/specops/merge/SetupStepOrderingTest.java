package com.gentoro.specops.merge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.model.SetupStep;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SetupStepOrderingTest {

  private static SetupStep step(String title, int order) {
    return new SetupStep(title, title, List.of(), List.of(), order);
  }

  @Test
  @DisplayName("With equal order an install step sorts before a test step")
  void installBeforeTest() {
    List<SetupStep> ordered =
        SetupStepOrdering.order(List.of(step("Test the build", 0), step("Install deps", 0)));
    assertEquals("Install deps", ordered.get(0).title());
  }

  @Test
  @DisplayName("Order is the primary key; unmatched titles get the default priority")
  void orderFirst() {
    List<SetupStep> ordered =
        SetupStepOrdering.order(
            List.of(step("Install deps", 1), step("Celebrate", 0), step("Test the build", 0)));
    assertEquals(
        List.of("Test the build", "Celebrate", "Install deps"),
        ordered.stream().map(SetupStep::title).toList());
    assertEquals(SetupStepOrdering.DEFAULT_PRIORITY, SetupStepOrdering.priority(step("Go", 0)));
    assertEquals(4, SetupStepOrdering.priority(step("Configure the proxy", 0)));
  }
}
