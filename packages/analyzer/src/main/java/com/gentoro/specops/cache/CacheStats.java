package com.gentoro.specops.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Snapshot of cache counters. */
public record CacheStats(
    @JsonProperty("relationship_cache_size") int relationshipCacheSize,
    @JsonProperty("fingerprint_misses") long fingerprintMisses,
    long hits) {}
