package com.thermacore.scada.core.cache;

import java.time.Instant;

/**
 * 缓存条目，expiresAt = capturedAt + ttl，写入后不再修改
 */
public record CacheEntry<V>(PointKey key, V value, Instant capturedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
