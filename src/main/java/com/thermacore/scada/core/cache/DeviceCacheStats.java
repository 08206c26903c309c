package com.thermacore.scada.core.cache;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.Map;

/**
 * 设备数据缓存快照
 */
@Data
@Builder
public class DeviceCacheStats {

    private final int entryCount;
    private final int maxSize;
    private final double ttlSeconds;
    private final int devicesTracked;

    @Builder.Default
    private final Map<String, Integer> perDeviceCounts = Collections.emptyMap();

    private final long totalPuts;
    private final long totalHits;
    private final long totalMisses;
    private final long totalEvictions;
    private final long totalExpirations;
    private final long totalInvalidations;
    private final double hitRate;
}
