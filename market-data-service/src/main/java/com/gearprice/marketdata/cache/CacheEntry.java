package com.gearprice.marketdata.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry wrapping a payload with its capture timestamp.
 *
 * <p>TTL belongs to the namespace ({@link JsonFileCacheStore}).
 */
public record CacheEntry<T>(
    String key,
    T payload,
    Instant capturedAt
) {

    /** Stale once strictly more than {@code ttl} has passed since capture. */
    public boolean isOlderThan(Duration ttl, Instant now) {
        return Duration.between(capturedAt, now).compareTo(ttl) > 0;
    }
}
