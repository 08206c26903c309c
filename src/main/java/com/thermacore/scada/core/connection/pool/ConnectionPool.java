package com.thermacore.scada.core.connection.pool;

import com.thermacore.scada.common.exception.CapacityException;
import com.thermacore.scada.common.exception.ConfigurationException;
import com.thermacore.scada.common.exception.ConnectionException;
import com.thermacore.scada.core.connection.ConnectionHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 带TTL的设备连接池
 * <p>
 * 过期采用惰性检查：每次查找时判断 now >= expiresAt，过期条目视为不存在并在此时移除。
 * 连接池已满时淘汰 expiresAt 最早的条目（相同时淘汰 establishedAt 最早的）。
 * 建立连接与关闭句柄都在锁外执行。
 */
@Slf4j
public class ConnectionPool {

    private static final String OP_GET_OR_CREATE = "get_or_create";

    @Getter
    private final int maxConnections;
    @Getter
    private final Duration ttl;
    private final boolean evictionEnabled;
    private final Clock clock;

    // deviceId -> 连接条目
    private final Map<String, PooledConnection> connections = new HashMap<>();
    private final Object lock = new Object();

    // 统计信息，仅在锁内修改
    private long totalCreated;
    private long totalReused;
    private long totalEvicted;
    private long totalExpired;

    public ConnectionPool(int maxConnections, Duration ttl, boolean evictionEnabled, Clock clock) {
        ConfigurationException.requirePositive("max-connections", maxConnections);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("connection-ttl-seconds", "连接TTL必须大于0: " + ttl);
        }
        this.maxConnections = maxConnections;
        this.ttl = ttl;
        this.evictionEnabled = evictionEnabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 获取设备连接，存在且未过期时复用，否则调用 connector 建立新连接
     */
    public ConnectionHandle getOrCreate(String deviceId, DeviceConnector connector) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(connector, "connector");

        List<ConnectionHandle> toClose = new ArrayList<>();
        try {
            synchronized (lock) {
                PooledConnection existing = lookupLocked(deviceId, clock.instant(), toClose);
                if (existing != null) {
                    existing.touch(clock.instant(), ttl);
                    totalReused++;
                    log.debug("复用设备连接: {}, 使用次数: {}", deviceId, existing.getUseCount());
                    return existing.getHandle();
                }
            }
        } finally {
            closeAll(toClose);
        }

        ConnectionHandle handle = establish(deviceId, connector);

        try {
            synchronized (lock) {
                Instant now = clock.instant();

                // 并发建立时以先入池者为准
                PooledConnection raced = lookupLocked(deviceId, now, toClose);
                if (raced != null) {
                    raced.touch(now, ttl);
                    totalReused++;
                    toClose.add(handle);
                    return raced.getHandle();
                }

                if (connections.size() >= maxConnections) {
                    purgeExpiredLocked(now, toClose);
                }
                if (connections.size() >= maxConnections) {
                    if (!evictionEnabled) {
                        toClose.add(handle);
                        throw new CapacityException("连接池已满", deviceId, OP_GET_OR_CREATE, maxConnections);
                    }
                    evictOneLocked(toClose);
                }

                connections.put(deviceId, new PooledConnection(deviceId, handle, now, ttl));
                totalCreated++;
                log.info("设备连接已加入连接池: {}, 当前连接数: {}/{}", deviceId, connections.size(), maxConnections);
                return handle;
            }
        } finally {
            closeAll(toClose);
        }
    }

    /**
     * 立即释放设备连接，不存在时忽略
     */
    public boolean release(String deviceId) {
        PooledConnection removed;
        synchronized (lock) {
            removed = connections.remove(deviceId);
        }
        if (removed == null) {
            return false;
        }
        closeQuietly(removed.getHandle());
        log.info("设备连接已释放: {}", deviceId);
        return true;
    }

    /**
     * 查询设备连接信息，只做一次查找，返回副本
     */
    public Optional<PooledConnection> connectionInfo(String deviceId) {
        List<ConnectionHandle> toClose = new ArrayList<>();
        try {
            synchronized (lock) {
                PooledConnection existing = lookupLocked(deviceId, clock.instant(), toClose);
                return existing == null ? Optional.empty() : Optional.of(existing.copy());
            }
        } finally {
            closeAll(toClose);
        }
    }

    /**
     * 主动清理过期连接，返回清理数量
     */
    public int purgeExpired() {
        List<ConnectionHandle> toClose = new ArrayList<>();
        int purged;
        synchronized (lock) {
            purged = purgeExpiredLocked(clock.instant(), toClose);
        }
        closeAll(toClose);
        if (purged > 0) {
            log.info("清理过期连接: {} 个", purged);
        }
        return purged;
    }

    public ConnectionPoolStats stats() {
        synchronized (lock) {
            Map<String, Long> usage = new LinkedHashMap<>();
            connections.forEach((deviceId, connection) -> usage.put(deviceId, connection.getUseCount()));
            return ConnectionPoolStats.builder()
                    .activeCount(connections.size())
                    .maxConnections(maxConnections)
                    .ttlSeconds(ttl.toMillis() / 1000.0)
                    .totalCreated(totalCreated)
                    .totalReused(totalReused)
                    .totalEvicted(totalEvicted)
                    .totalExpired(totalExpired)
                    .deviceUsage(usage)
                    .build();
        }
    }

    /**
     * 关闭全部连接
     */
    public void closeAll() {
        List<ConnectionHandle> toClose = new ArrayList<>();
        synchronized (lock) {
            connections.values().forEach(connection -> toClose.add(connection.getHandle()));
            connections.clear();
        }
        closeAll(toClose);
        log.info("连接池已关闭, 释放连接 {} 个", toClose.size());
    }

    private ConnectionHandle establish(String deviceId, DeviceConnector connector) {
        ConnectionHandle handle;
        try {
            handle = connector.connect(deviceId);
        } catch (ConnectionException e) {
            throw e;
        } catch (Exception e) {
            log.error("建立设备连接失败: {}", deviceId, e);
            throw new ConnectionException("建立设备连接失败", deviceId, OP_GET_OR_CREATE, e);
        }
        if (handle == null) {
            throw new ConnectionException("连接例程返回空句柄", deviceId, OP_GET_OR_CREATE);
        }
        return handle;
    }

    private PooledConnection lookupLocked(String deviceId, Instant now, List<ConnectionHandle> toClose) {
        PooledConnection existing = connections.get(deviceId);
        if (existing == null) {
            return null;
        }
        if (existing.isExpired(now) || !existing.getHandle().isOpen()) {
            connections.remove(deviceId);
            totalExpired++;
            toClose.add(existing.getHandle());
            log.debug("设备连接已过期或失效: {}", deviceId);
            return null;
        }
        return existing;
    }

    private int purgeExpiredLocked(Instant now, List<ConnectionHandle> toClose) {
        int purged = 0;
        Iterator<PooledConnection> iterator = connections.values().iterator();
        while (iterator.hasNext()) {
            PooledConnection connection = iterator.next();
            if (connection.isExpired(now)) {
                iterator.remove();
                toClose.add(connection.getHandle());
                totalExpired++;
                purged++;
            }
        }
        return purged;
    }

    private void evictOneLocked(List<ConnectionHandle> toClose) {
        PooledConnection victim = connections.values().stream()
                .min(Comparator.comparing(PooledConnection::getExpiresAt)
                        .thenComparing(PooledConnection::getEstablishedAt))
                .orElseThrow();
        connections.remove(victim.getDeviceId());
        toClose.add(victim.getHandle());
        totalEvicted++;
        log.warn("连接池已满，淘汰设备连接: {}, expiresAt={}", victim.getDeviceId(), victim.getExpiresAt());
    }

    private void closeAll(List<ConnectionHandle> handles) {
        for (ConnectionHandle handle : handles) {
            closeQuietly(handle);
        }
        handles.clear();
    }

    private void closeQuietly(ConnectionHandle handle) {
        try {
            handle.close();
        } catch (Exception e) {
            log.error("关闭设备连接失败: {}", handle.getDeviceId(), e);
        }
    }
}
