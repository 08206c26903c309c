package com.thermacore.scada.core.connection.pool;

import com.thermacore.scada.core.connection.ConnectionHandle;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 连接池条目
 * <p>
 * 过期时间按最近一次使用滑动计算：expiresAt = lastUsedAt + ttl。
 * 仅在连接池锁内修改。
 */
@Getter
@ToString(exclude = "handle")
public class PooledConnection {

    private final String deviceId;
    private final ConnectionHandle handle;
    private final Instant establishedAt;
    private Instant lastUsedAt;
    private Instant expiresAt;
    private long useCount;

    PooledConnection(String deviceId, ConnectionHandle handle, Instant now, Duration ttl) {
        this.deviceId = deviceId;
        this.handle = handle;
        this.establishedAt = now;
        this.lastUsedAt = now;
        this.expiresAt = now.plus(ttl);
        this.useCount = 1;
    }

    private PooledConnection(PooledConnection source) {
        this.deviceId = source.deviceId;
        this.handle = source.handle;
        this.establishedAt = source.establishedAt;
        this.lastUsedAt = source.lastUsedAt;
        this.expiresAt = source.expiresAt;
        this.useCount = source.useCount;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void touch(Instant now, Duration ttl) {
        this.lastUsedAt = now;
        this.expiresAt = now.plus(ttl);
        this.useCount++;
    }

    PooledConnection copy() {
        return new PooledConnection(this);
    }
}
