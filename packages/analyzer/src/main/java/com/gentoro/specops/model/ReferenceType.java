package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReferenceType {
  LINK("link"),
  TEXTUAL_REFERENCE("textual_reference");

  private final String wireName;

  ReferenceType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
