package com.optiontrader.volatility;

import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Wraps a {@link VolatilityRecord} with the instant it was cached, for TTL checks at
 * read time. Entries are never swept in the background.
 */
@Data
@AllArgsConstructor
class CachedVolatilityRecord {

    private final VolatilityRecord record;
    private final Instant cachedAt;

    /** True once the elapsed time since caching has reached the TTL. */
    boolean isExpired(Duration ttl) {
        return Duration.between(cachedAt, Instant.now()).compareTo(ttl) >= 0;
    }
}
