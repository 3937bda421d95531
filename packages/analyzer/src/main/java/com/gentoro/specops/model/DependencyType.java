package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DependencyType {
  RUNTIME,
  DEV,
  OPTIONAL,
  PEER,
  BUILD;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
