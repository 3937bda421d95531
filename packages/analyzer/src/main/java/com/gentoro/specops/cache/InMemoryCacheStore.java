package com.gentoro.specops.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/** Unbounded process-local store. Entries live until {@link #clear()}. */
public class InMemoryCacheStore<V> implements CacheStore<V> {
  private final ConcurrentMap<String, V> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<V> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public V computeIfAbsent(String key, Function<String, ? extends V> loader) {
    return entries.computeIfAbsent(key, loader);
  }

  @Override
  public void clear() {
    entries.clear();
  }

  @Override
  public int size() {
    return entries.size();
  }
}
