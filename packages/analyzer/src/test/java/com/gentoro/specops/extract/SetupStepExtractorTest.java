package com.gentoro.specops.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specops.model.SetupStep;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SetupStepExtractorTest {

  private final SetupStepExtractor extractor = new SetupStepExtractor();

  @Test
  @DisplayName("Numbered items open steps and unmarked lines extend them")
  void numberedSteps() {
    String md =
        "## Installation\n"
            + "1. Install Python\n"
            + "   Use the official installer.\n"
            + "2. Run: pip install foo\n"
            + "## Testing\n"
            + "not a setup section\n"
            + "## Configuration\n"
            + "Edit the config file.\n";
    List<SetupStep> steps = extractor.extract(md, "README.md");

    assertEquals(3, steps.size());
    assertEquals("Install Python", steps.get(0).title());
    assertEquals("Install Python Use the official installer.", steps.get(0).description());
    assertEquals(0, steps.get(0).order());

    assertEquals("Run: pip install foo", steps.get(1).title());
    assertEquals(List.of("pip install foo"), steps.get(1).commands());
    assertEquals(1, steps.get(1).order());

    // no markers: one step named after the heading
    assertEquals("Configuration", steps.get(2).title());
    assertEquals("Edit the config file.", steps.get(2).description());
    assertEquals(2, steps.get(2).order());
  }

  @Test
  @DisplayName("Bullets and 'Step N:' lines are step markers too")
  void otherMarkers() {
    String md = "## Prerequisites\n- Python 3.8\n* Git\nStep 3: Clone the repo\n";
    List<SetupStep> steps = extractor.extract(md, "a.md");
    assertEquals(
        List.of("Python 3.8", "Git", "Clone the repo"),
        steps.stream().map(SetupStep::title).toList());
    assertEquals(List.of(0, 1, 2), steps.stream().map(SetupStep::order).toList());
  }

  @Test
  @DisplayName("Titles are truncated to 50 characters")
  void longTitle() {
    String item = "Install " + "a".repeat(60);
    SetupStep step = extractor.extract("## Setup\n1. " + item + "\n", "a.md").get(0);
    assertEquals(53, step.title().length());
    assertEquals(item, step.description());
  }

  @Test
  @DisplayName("An imperative run line yields exactly the pip command")
  void runPipInstall() {
    List<SetupStep> steps =
        extractor.extract("## Installation\n\n1. Run pip install -r requirements.txt", "R.md");
    assertEquals(1, steps.size());
    assertEquals(List.of("pip install -r requirements.txt"), steps.get(0).commands());
  }

  @Test
  @DisplayName("Sections without a setup keyword yield nothing")
  void noSetupSections() {
    assertTrue(extractor.extract("# Overview\n1. Not a step\n", "a.md").isEmpty());
  }
}
