package com.gentoro.specops.extract;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandDetectorTest {

  @Test
  @DisplayName("Imperative run phrases keep only the command")
  void imperativeRun() {
    assertEquals(
        List.of("pip install -r requirements.txt"),
        CommandDetector.detect("Run pip install -r requirements.txt"));
  }

  @Test
  @DisplayName("Prose starting with 'make sure' is not a command")
  void makeSureIsProse() {
    assertTrue(CommandDetector.detect("Make sure you have Python installed").isEmpty());
    assertTrue(CommandDetector.detect("Run the tests when you are done").isEmpty());
  }

  @Test
  @DisplayName("Inline code, prompts and labels are recognized in order without duplicates")
  void mixedForms() {
    assertEquals(
        List.of("docker compose up", "npm test"),
        CommandDetector.detect("Use `docker compose up` then run `npm test`."));
    assertEquals(
        List.of("git clone https://example.com/repo.git"),
        CommandDetector.detect("$ git clone https://example.com/repo.git"));
    assertEquals(List.of("npm install"), CommandDetector.detect("Run: npm install\n$ npm install"));
    assertEquals(List.of("mvn -B verify"), CommandDetector.detect("> mvn -B verify"));
  }

  @Test
  @DisplayName("A single line starting with a tool invocation is a command")
  void bareCommandLine() {
    assertEquals(
        List.of("python manage.py migrate"), CommandDetector.detect("python manage.py migrate"));
    assertTrue(CommandDetector.looksLikeCommand("sudo apt-get install curl"));
    assertFalse(CommandDetector.looksLikeCommand("read the docs"));
  }
}
