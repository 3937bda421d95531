package com.gentoro.specops.cache;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes complete analysis results by fingerprint key. Keys ending in {@code no_hash} bypass
 * the store entirely. Concurrent callers with the same key compute once.
 */
public class AnalysisCache<V> {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(AnalysisCache.class);

  private final CacheStore<V> store;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public AnalysisCache() {
    this(new InMemoryCacheStore<>());
  }

  public AnalysisCache(CacheStore<V> store) {
    this.store = store;
  }

  public V getOrCompute(String key, Supplier<? extends V> loader) {
    if (!CacheKeyGenerator.isCacheable(key)) {
      misses.incrementAndGet();
      return loader.get();
    }
    V cached = store.get(key).orElse(null);
    if (cached != null) {
      hits.incrementAndGet();
      log.debug("Cache hit for {}", key);
      return cached;
    }
    return store.computeIfAbsent(
        key,
        k -> {
          misses.incrementAndGet();
          log.debug("Cache miss for {}", k);
          return loader.get();
        });
  }

  public void clear() {
    store.clear();
  }

  public CacheStats stats() {
    return new CacheStats(store.size(), misses.get(), hits.get());
  }
}
