package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A fenced code block lifted from documentation, with the text that introduced it. */
public record CodeExample(
    String title,
    String code,
    String language,
    String description,
    @JsonProperty("file_path") String filePath) {

  public CodeExample {
    Validation.requireText(title, "title");
    Validation.requireText(code, "code");
    Validation.requireText(language, "language");
    Validation.requireText(description, "description");
    Validation.requireText(filePath, "file_path");
  }
}
