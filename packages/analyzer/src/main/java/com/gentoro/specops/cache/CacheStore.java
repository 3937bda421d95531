package com.gentoro.specops.cache;

import java.util.Optional;
import java.util.function.Function;

/** Key/value storage behind {@link AnalysisCache}. Implementations must be thread-safe. */
public interface CacheStore<V> {

  Optional<V> get(String key);

  /**
   * Return the stored value, computing and storing it when absent. Other callers never observe
   * a partially computed entry.
   */
  V computeIfAbsent(String key, Function<String, ? extends V> loader);

  void clear();

  int size();
}
