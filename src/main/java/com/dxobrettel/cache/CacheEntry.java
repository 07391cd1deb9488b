package com.dxobrettel.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One stored id mapping, keyed by (namespace, key).
 */
public record CacheEntry(
        String namespace,
        String key,
        long value,
        Instant timestamp
) {
    public boolean isExpired(Instant now, Duration timeout) {
        return Duration.between(timestamp, now).compareTo(timeout) > 0;
    }
}
