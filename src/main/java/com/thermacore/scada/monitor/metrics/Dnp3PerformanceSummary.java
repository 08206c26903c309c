package com.thermacore.scada.monitor.metrics;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DNP3 性能概要
 */
@Data
@Builder
public class Dnp3PerformanceSummary {

    // 累计操作次数
    private final long totalOperations;
    // 平均响应时间与成功率按保留窗口计算
    private final double averageResponseTimeMs;
    private final double successRatePercent;

    private final double cacheHitRate;
    private final int activeConnections;
    private final int connectedDevices;

    @Builder.Default
    private final Map<String, Boolean> performanceOptimizations = new LinkedHashMap<>();
}
