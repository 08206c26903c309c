package com.thermacore.scada.monitor.metrics;

import com.thermacore.scada.common.exception.ConfigurationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.*;

/**
 * 操作性能指标记录器
 * <p>
 * 每个操作保留最近 maxHistory 条采样，超出后丢弃最早的一条。
 * 统计值按保留窗口计算，不是全生命周期值。
 */
@Slf4j
public class PerformanceMetricsRecorder {

    @Getter
    private final int maxHistory;
    private final Clock clock;

    private final Map<String, ArrayDeque<OperationSample>> history = new HashMap<>();
    private final Map<String, Long> lifetimeCounts = new HashMap<>();
    private final Object lock = new Object();

    public PerformanceMetricsRecorder(int maxHistory, Clock clock) {
        ConfigurationException.requirePositive("metrics-max-history", maxHistory);
        this.maxHistory = maxHistory;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void record(String operationName, Duration duration, boolean success) {
        record(operationName, duration, success, 0);
    }

    /**
     * 追加一条采样
     */
    public void record(String operationName, Duration duration, boolean success, int dataPointCount) {
        Objects.requireNonNull(operationName, "operationName");
        Duration safeDuration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        OperationSample sample = new OperationSample(operationName, safeDuration, success,
                clock.instant(), Math.max(0, dataPointCount));

        synchronized (lock) {
            ArrayDeque<OperationSample> samples = history.computeIfAbsent(operationName, k -> new ArrayDeque<>());
            samples.addLast(sample);
            if (samples.size() > maxHistory) {
                samples.removeFirst();
            }
            lifetimeCounts.merge(operationName, 1L, Long::sum);
        }
    }

    public OperationStats stats(String operationName) {
        List<OperationSample> window;
        long lifetime;
        synchronized (lock) {
            ArrayDeque<OperationSample> samples = history.get(operationName);
            if (samples == null || samples.isEmpty()) {
                return OperationStats.empty(operationName);
            }
            window = new ArrayList<>(samples);
            lifetime = lifetimeCounts.getOrDefault(operationName, 0L);
        }
        return summarize(operationName, window, lifetime);
    }

    public Map<String, OperationStats> allStats() {
        Map<String, List<OperationSample>> snapshot = new TreeMap<>();
        Map<String, Long> lifetime;
        synchronized (lock) {
            history.forEach((operation, samples) -> snapshot.put(operation, new ArrayList<>(samples)));
            lifetime = new HashMap<>(lifetimeCounts);
        }
        Map<String, OperationStats> result = new LinkedHashMap<>();
        snapshot.forEach((operation, samples) -> result.put(operation,
                samples.isEmpty() ? OperationStats.empty(operation)
                        : summarize(operation, samples, lifetime.getOrDefault(operation, 0L))));
        return result;
    }

    /**
     * 保留窗口内的采样副本，按时间先后排列
     */
    public List<OperationSample> samples(String operationName) {
        synchronized (lock) {
            ArrayDeque<OperationSample> samples = history.get(operationName);
            return samples == null ? Collections.emptyList() : new ArrayList<>(samples);
        }
    }

    /**
     * 全部操作的累计记录次数
     */
    public long totalOperations() {
        synchronized (lock) {
            return lifetimeCounts.values().stream().mapToLong(Long::longValue).sum();
        }
    }

    /**
     * 清空全部采样
     */
    public void reset() {
        synchronized (lock) {
            history.clear();
            lifetimeCounts.clear();
        }
        log.info("性能指标已重置");
    }

    private OperationStats summarize(String operation, List<OperationSample> samples, long lifetime) {
        int errors = 0;
        long totalNanos = 0;
        long minNanos = Long.MAX_VALUE;
        long maxNanos = 0;
        long points = 0;
        long pointNanos = 0;

        for (OperationSample sample : samples) {
            long nanos = sample.duration().toNanos();
            totalNanos += nanos;
            minNanos = Math.min(minNanos, nanos);
            maxNanos = Math.max(maxNanos, nanos);
            if (!sample.success()) {
                errors++;
            }
            if (sample.dataPointCount() > 0) {
                points += sample.dataPointCount();
                pointNanos += nanos;
            }
        }

        int count = samples.size();
        return OperationStats.builder()
                .operation(operation)
                .noData(false)
                .count(count)
                .errors(errors)
                .lifetimeCount(lifetime)
                .avgTimeMs(totalNanos / (double) count / 1_000_000.0)
                .minTimeMs(minNanos / 1_000_000.0)
                .maxTimeMs(maxNanos / 1_000_000.0)
                .successRate((count - errors) * 100.0 / count)
                .throughputPointsPerSecond(pointNanos > 0 ? points / (pointNanos / 1_000_000_000.0) : 0.0)
                .build();
    }
}
