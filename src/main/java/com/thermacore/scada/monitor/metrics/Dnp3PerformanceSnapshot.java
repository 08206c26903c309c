package com.thermacore.scada.monitor.metrics;

import com.thermacore.scada.core.cache.DeviceCacheStats;
import com.thermacore.scada.core.connection.pool.ConnectionPoolStats;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DNP3 性能指标快照
 */
@Data
@Builder
public class Dnp3PerformanceSnapshot {

    private final Instant timestamp;

    @Builder.Default
    private final Map<String, OperationStats> operationMetrics = new LinkedHashMap<>();

    private final ConnectionPoolStats connectionPool;
    private final DeviceCacheStats dataCache;

    @Builder.Default
    private final Map<String, Object> configuration = new LinkedHashMap<>();
}
