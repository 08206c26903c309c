package com.thermacore.scada.monitor.metrics;

import com.thermacore.scada.core.cache.DeviceCacheStats;
import com.thermacore.scada.core.connection.pool.ConnectionPoolStats;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Service;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期输出连接池、缓存与性能概要，并清理过期连接和缓存
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Dnp3StatusReporter {

    private final Dnp3Service dnp3Service;

    @Scheduled(fixedDelayString = "${thermacore.dnp3.status-log-interval-ms:300000}",
            initialDelayString = "${thermacore.dnp3.status-log-interval-ms:300000}")
    public void report() {
        if (!dnp3Service.isRunning()) {
            return;
        }
        try {
            int expiredConnections = dnp3Service.getConnectionPool().purgeExpired();
            int expiredEntries = dnp3Service.getDataCache().purgeExpired();

            ConnectionPoolStats pool = dnp3Service.getConnectionPool().stats();
            DeviceCacheStats cache = dnp3Service.getDataCache().stats();
            Dnp3PerformanceSummary summary = dnp3Service.getPerformanceSummary();

            log.info("DNP3连接池: {}/{}, 新建: {}, 复用: {}, 淘汰: {}, 过期: {} (本次清理 {})",
                    pool.getActiveCount(), pool.getMaxConnections(), pool.getTotalCreated(),
                    pool.getTotalReused(), pool.getTotalEvicted(), pool.getTotalExpired(), expiredConnections);
            log.info("DNP3缓存: {}/{}, 设备数: {}, 命中率: {}%, 淘汰: {}, 过期: {} (本次清理 {})",
                    cache.getEntryCount(), cache.getMaxSize(), cache.getDevicesTracked(),
                    String.format("%.2f", cache.getHitRate()), cache.getTotalEvictions(),
                    cache.getTotalExpirations(), expiredEntries);
            log.info("DNP3性能: 操作总数: {}, 平均响应: {}ms, 成功率: {}%",
                    summary.getTotalOperations(), String.format("%.3f", summary.getAverageResponseTimeMs()),
                    String.format("%.2f", summary.getSuccessRatePercent()));
        } catch (RuntimeException e) {
            log.error("DNP3状态报告失败", e);
        }
    }
}
