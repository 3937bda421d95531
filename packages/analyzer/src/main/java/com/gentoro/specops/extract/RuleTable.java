package com.gentoro.specops.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered list of {@code (predicate, result)} pairs. Lookups walk the rules in declaration order
 * and the first matching rule wins, so table order is significant.
 *
 * <p>The keyword helpers on {@link Builder} match case-insensitively; custom predicates receive
 * the input untouched.
 */
public final class RuleTable<T> {

  public record Rule<T>(String label, Predicate<String> predicate, T result) {}

  private final List<Rule<T>> rules;

  private RuleTable(List<Rule<T>> rules) {
    this.rules = List.copyOf(rules);
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /** A table whose rules each map a keyword to itself. */
  public static RuleTable<String> keywords(String... keywords) {
    Builder<String> b = builder();
    for (String k : keywords) {
      b.whenContains(k, k);
    }
    return b.build();
  }

  public Optional<T> firstMatch(String input) {
    if (input == null) return Optional.empty();
    for (Rule<T> rule : rules) {
      if (rule.predicate().test(input)) {
        return Optional.of(rule.result());
      }
    }
    return Optional.empty();
  }

  public T lookup(String input, T fallback) {
    return firstMatch(input).orElse(fallback);
  }

  public boolean anyMatch(String input) {
    return firstMatch(input).isPresent();
  }

  public List<Rule<T>> rules() {
    return rules;
  }

  public static final class Builder<T> {
    private final List<Rule<T>> rules = new ArrayList<>();

    private Builder() {}

    public Builder<T> when(String label, Predicate<String> predicate, T result) {
      rules.add(new Rule<>(label, predicate, result));
      return this;
    }

    public Builder<T> whenContains(String keyword, T result) {
      String k = keyword.toLowerCase(Locale.ROOT);
      return when(keyword, s -> s.toLowerCase(Locale.ROOT).contains(k), result);
    }

    public Builder<T> whenContainsAny(T result, String... keywords) {
      return when(
          "any" + List.of(keywords),
          s -> {
            String lower = s.toLowerCase(Locale.ROOT);
            for (String k : keywords) {
              if (lower.contains(k.toLowerCase(Locale.ROOT))) return true;
            }
            return false;
          },
          result);
    }

    public Builder<T> whenContainsAll(T result, String... keywords) {
      return when(
          "all" + List.of(keywords),
          s -> {
            String lower = s.toLowerCase(Locale.ROOT);
            for (String k : keywords) {
              if (!lower.contains(k.toLowerCase(Locale.ROOT))) return false;
            }
            return true;
          },
          result);
    }

    public RuleTable<T> build() {
      return new RuleTable<>(rules);
    }
  }
}
