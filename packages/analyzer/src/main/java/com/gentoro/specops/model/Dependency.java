package com.gentoro.specops.model;

import com.gentoro.specops.exception.ValidationException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A project dependency found in documentation or in a package manifest.
 *
 * <p>{@code version} is optional. When present it is a version token ({@code [\w.\-+]+}),
 * optionally prefixed by the comparator it was declared with, e.g. {@code ==2.28.0} or {@code
 * >=1.4}.
 */
public record Dependency(String name, String version, DependencyType type, String description) {

  public static final Pattern VERSION_PATTERN =
      Pattern.compile("^(?:==|>=|<=|~=|!=|~>|\\^|~|>|<)?[\\w.\\-+]+$");

  public Dependency {
    Validation.requireText(name, "name");
    if (version != null && !VERSION_PATTERN.matcher(version).matches()) {
      throw new ValidationException(
          "version format is invalid: " + version, Map.of("field", "version", "value", version));
    }
    Validation.requireNonNull(type, "type");
    Validation.requireNonNull(description, "description");
  }

  public static Dependency runtime(String name, String version, String description) {
    return new Dependency(name, version, DependencyType.RUNTIME, description);
  }

  public boolean hasVersion() {
    return version != null && !version.isEmpty();
  }

  /** Identity used for deduplication: lower-cased, trimmed name. */
  public String key() {
    return name.toLowerCase(Locale.ROOT).strip();
  }
}
