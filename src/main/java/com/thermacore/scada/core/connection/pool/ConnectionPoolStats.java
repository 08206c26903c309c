package com.thermacore.scada.core.connection.pool;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.Map;

/**
 * 连接池只读快照
 */
@Data
@Builder
public class ConnectionPoolStats {

    private final int activeCount;
    private final int maxConnections;
    private final double ttlSeconds;

    private final long totalCreated;
    private final long totalReused;
    private final long totalEvicted;
    private final long totalExpired;

    // deviceId -> 当前连接的使用次数
    @Builder.Default
    private final Map<String, Long> deviceUsage = Collections.emptyMap();
}
