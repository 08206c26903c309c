package com.thermacore.scada.monitor.metrics;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次操作采样，写入后不再修改
 */
public record OperationSample(String operationName,
                              Duration duration,
                              boolean success,
                              Instant timestamp,
                              int dataPointCount) {
}
