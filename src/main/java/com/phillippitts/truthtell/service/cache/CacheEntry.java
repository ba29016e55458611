package com.phillippitts.truthtell.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored value with its creation time and time-to-live.
 */
record CacheEntry(Object value, Instant createdAt, Duration ttl) {

    /**
     * An entry is expired once its age exceeds its TTL.
     */
    boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
