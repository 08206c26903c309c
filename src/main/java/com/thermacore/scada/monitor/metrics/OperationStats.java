package com.thermacore.scada.monitor.metrics;

import lombok.Builder;
import lombok.Data;

/**
 * 操作统计，基于保留窗口内的采样计算
 */
@Data
@Builder
public class OperationStats {

    private final String operation;
    private final boolean noData;

    // 窗口内采样数与失败数
    private final int count;
    private final int errors;
    // 累计记录次数（不受窗口限制）
    private final long lifetimeCount;

    private final double avgTimeMs;
    private final double minTimeMs;
    private final double maxTimeMs;
    // 百分比
    private final double successRate;
    private final double throughputPointsPerSecond;

    public static OperationStats empty(String operation) {
        return OperationStats.builder()
                .operation(operation)
                .noData(true)
                .build();
    }
}
