package com.thermacore.scada.core.config;

import com.thermacore.scada.common.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DNP3 性能优化配置
 * <p>
 * 非正数配置在构造服务时直接拒绝，不做修正。
 */
@Data
@ConfigurationProperties(prefix = "thermacore.dnp3")
public class Dnp3Properties {

    /**
     * 连接池最大连接数
     */
    private int maxConnections = 20;

    /**
     * 连接空闲TTL（秒），按最近一次使用计算
     */
    private double connectionTtlSeconds = 300.0;

    /**
     * 数据缓存最大条目数
     */
    private int cacheMaxSize = 1024;

    /**
     * 数据缓存TTL（秒），写入时固定
     */
    private double cacheTtlSeconds = 2.0;

    /**
     * 每个操作保留的性能采样数
     */
    private int metricsMaxHistory = 1000;

    /**
     * 协议读写默认超时（毫秒）
     */
    private long readTimeoutMs = 5000;

    /**
     * 协议IO线程数
     */
    private int ioThreads = 8;

    /**
     * 状态日志输出间隔（毫秒）
     */
    private long statusLogIntervalMs = 300_000;

    private boolean poolEvictionEnabled = true;
    private boolean cacheEvictionEnabled = true;
    private boolean cachingEnabled = true;
    private boolean bulkOperationsEnabled = true;

    /**
     * 校验配置
     */
    public void validate() {
        ConfigurationException.requirePositive("max-connections", maxConnections);
        ConfigurationException.requirePositive("connection-ttl-seconds", connectionTtlSeconds);
        ConfigurationException.requirePositive("cache-max-size", cacheMaxSize);
        ConfigurationException.requirePositive("cache-ttl-seconds", cacheTtlSeconds);
        ConfigurationException.requirePositive("metrics-max-history", metricsMaxHistory);
        ConfigurationException.requirePositive("read-timeout-ms", readTimeoutMs);
        ConfigurationException.requirePositive("io-threads", ioThreads);
        ConfigurationException.requirePositive("status-log-interval-ms", statusLogIntervalMs);
    }

    public Duration connectionTtl() {
        return toDuration(connectionTtlSeconds);
    }

    public Duration cacheTtl() {
        return toDuration(cacheTtlSeconds);
    }

    public Duration readTimeout() {
        return Duration.ofMillis(readTimeoutMs);
    }

    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("maxConnections", maxConnections);
        summary.put("connectionTtlSeconds", connectionTtlSeconds);
        summary.put("cacheMaxSize", cacheMaxSize);
        summary.put("cacheTtlSeconds", cacheTtlSeconds);
        summary.put("metricsMaxHistory", metricsMaxHistory);
        summary.put("readTimeoutMs", readTimeoutMs);
        summary.put("poolEvictionEnabled", poolEvictionEnabled);
        summary.put("cacheEvictionEnabled", cacheEvictionEnabled);
        return summary;
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
