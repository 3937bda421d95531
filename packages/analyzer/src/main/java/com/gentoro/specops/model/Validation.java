package com.gentoro.specops.model;

import com.gentoro.specops.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/** Construction-time checks shared by the model records. */
final class Validation {
  private Validation() {}

  static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " must be a non-empty string", Map.of("field", field));
    }
    return value;
  }

  static <T> T requireNonNull(T value, String field) {
    if (value == null) {
      throw new ValidationException(field + " must not be null", Map.of("field", field));
    }
    return value;
  }

  static int requireRange(int value, int min, int max, String field) {
    if (value < min || value > max) {
      throw new ValidationException(
          field + " must be an integer between " + min + " and " + max + ", got " + value,
          Map.of("field", field, "value", value));
    }
    return value;
  }

  static List<String> copyStrings(Collection<String> values, String field) {
    if (values == null) return List.of();
    List<String> out = new ArrayList<>(values.size());
    for (String v : values) {
      if (v == null) {
        throw new ValidationException(
            "all " + field + " entries must be strings", Map.of("field", field));
      }
      out.add(v);
    }
    return Collections.unmodifiableList(out);
  }

  /** Sorted so that serialized sets are stable between runs. */
  static SortedSet<String> copySortedSet(Collection<String> values, String field) {
    if (values == null) return Collections.emptySortedSet();
    SortedSet<String> out = new TreeSet<>();
    for (String v : values) {
      if (v == null) {
        throw new ValidationException(
            "all " + field + " entries must be strings", Map.of("field", field));
      }
      out.add(v);
    }
    return Collections.unmodifiableSortedSet(out);
  }
}
