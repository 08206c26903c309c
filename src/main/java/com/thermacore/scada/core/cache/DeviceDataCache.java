package com.thermacore.scada.core.cache;

import com.thermacore.scada.common.exception.CapacityException;
import com.thermacore.scada.common.exception.ConfigurationException;
import com.thermacore.scada.common.exception.InvariantViolationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 按设备索引的点位数据缓存
 * <p>
 * TTL在写入时固定，读取不续期。entries 按写入顺序排列（覆盖写会移到队尾），
 * 由于TTL固定，队首即 expiresAt 最早的条目，容量淘汰从队首开始。
 * deviceIndex 与 entries 在同一把锁内同步维护，按设备失效只访问该设备的点位。
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class DeviceDataCache<V> {

    private static final String OP_PUT = "cache_put";
    private static final String OP_GET = "cache_get";
    private static final String OP_INVALIDATE = "cache_invalidate";

    @Getter
    private final int maxSize;
    @Getter
    private final Duration ttl;
    private final boolean evictionEnabled;
    private final Clock clock;

    private final LinkedHashMap<PointKey, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final Map<String, Set<Integer>> deviceIndex = new HashMap<>();
    private final Object lock = new Object();

    // 统计信息，仅在锁内修改
    private long totalPuts;
    private long totalHits;
    private long totalMisses;
    private long totalEvictions;
    private long totalExpirations;
    private long totalInvalidations;

    // 按设备失效时实际访问的条目数
    private long lastInvalidationTouched;
    private long totalInvalidationTouches;

    public DeviceDataCache(int maxSize, Duration ttl, boolean evictionEnabled, Clock clock) {
        ConfigurationException.requirePositive("cache-max-size", maxSize);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("cache-ttl-seconds", "缓存TTL必须大于0: " + ttl);
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.evictionEnabled = evictionEnabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 写入或覆盖缓存
     */
    public void put(String deviceId, int pointIndex, V value) {
        Objects.requireNonNull(value, "value");
        PointKey key = new PointKey(deviceId, pointIndex);

        synchronized (lock) {
            Instant now = clock.instant();

            // 覆盖写先移除旧条目，使其移动到队尾
            if (entries.remove(key) == null) {
                if (entries.size() >= maxSize) {
                    purgeExpiredHeadLocked(now);
                }
                if (entries.size() >= maxSize) {
                    if (!evictionEnabled) {
                        throw new CapacityException("数据缓存已满", deviceId, OP_PUT, maxSize);
                    }
                    evictOldestLocked();
                }
            }

            entries.put(key, new CacheEntry<>(key, value, now, now.plus(ttl)));
            deviceIndex.computeIfAbsent(deviceId, k -> new HashSet<>()).add(pointIndex);
            totalPuts++;
        }
        log.debug("缓存写入: {}", key);
    }

    /**
     * 读取缓存，过期条目视为不存在并在此时清除
     */
    public Optional<V> get(String deviceId, int pointIndex) {
        PointKey key = new PointKey(deviceId, pointIndex);
        synchronized (lock) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                totalMisses++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                removeLocked(key, OP_GET);
                totalExpirations++;
                totalMisses++;
                return Optional.empty();
            }
            totalHits++;
            return Optional.of(entry.value());
        }
    }

    /**
     * 读取缓存条目（含写入与过期时间）
     */
    public Optional<CacheEntry<V>> getEntry(String deviceId, int pointIndex) {
        PointKey key = new PointKey(deviceId, pointIndex);
        synchronized (lock) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                removeLocked(key, OP_GET);
                totalExpirations++;
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    /**
     * 失效单个点位
     */
    public boolean invalidate(String deviceId, int pointIndex) {
        PointKey key = new PointKey(deviceId, pointIndex);
        synchronized (lock) {
            if (!entries.containsKey(key)) {
                return false;
            }
            removeLocked(key, OP_INVALIDATE);
            totalInvalidations++;
            return true;
        }
    }

    /**
     * 失效设备的全部缓存，只访问索引中该设备的点位
     *
     * @return 移除的条目数
     */
    public int invalidateDevice(String deviceId) {
        int removed = 0;
        Integer missing = null;
        synchronized (lock) {
            Set<Integer> points = deviceIndex.remove(deviceId);
            lastInvalidationTouched = 0;
            if (points == null) {
                return 0;
            }
            for (Integer pointIndex : points) {
                lastInvalidationTouched++;
                if (entries.remove(new PointKey(deviceId, pointIndex)) != null) {
                    removed++;
                } else {
                    missing = pointIndex;
                }
            }
            totalInvalidationTouches += lastInvalidationTouched;
            totalInvalidations += removed;
        }
        if (missing != null) {
            throw new InvariantViolationException("设备索引中存在无对应缓存的点位", deviceId, OP_INVALIDATE, missing);
        }
        log.debug("设备缓存已失效: {}, 移除 {} 条", deviceId, removed);
        return removed;
    }

    /**
     * 清理全部过期条目
     */
    public int purgeExpired() {
        synchronized (lock) {
            return purgeAllExpiredLocked(clock.instant());
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
            deviceIndex.clear();
        }
    }

    /**
     * 设备当前在索引中的点位
     */
    public Set<Integer> indexedPoints(String deviceId) {
        synchronized (lock) {
            Set<Integer> points = deviceIndex.get(deviceId);
            return points == null ? Collections.emptySet() : new TreeSet<>(points);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /**
     * 清理过期条目后校验索引与缓存的双向一致性
     */
    public void verifyConsistency() {
        synchronized (lock) {
            purgeAllExpiredLocked(clock.instant());
            int indexed = 0;
            for (Map.Entry<String, Set<Integer>> device : deviceIndex.entrySet()) {
                if (device.getValue().isEmpty()) {
                    throw new InvariantViolationException("设备索引存在空点位集合", device.getKey(), "verify", null);
                }
                for (Integer pointIndex : device.getValue()) {
                    if (!entries.containsKey(new PointKey(device.getKey(), pointIndex))) {
                        throw new InvariantViolationException("设备索引中存在无对应缓存的点位",
                                device.getKey(), "verify", pointIndex);
                    }
                    indexed++;
                }
            }
            for (PointKey key : entries.keySet()) {
                Set<Integer> points = deviceIndex.get(key.deviceId());
                if (points == null || !points.contains(key.pointIndex())) {
                    throw new InvariantViolationException("缓存条目未登记到设备索引",
                            key.deviceId(), "verify", key.pointIndex());
                }
            }
            if (indexed != entries.size()) {
                throw new InvariantViolationException("索引条目数与缓存条目数不一致", null, "verify", null);
            }
        }
    }

    public long getLastInvalidationTouched() {
        synchronized (lock) {
            return lastInvalidationTouched;
        }
    }

    public long getTotalInvalidationTouches() {
        synchronized (lock) {
            return totalInvalidationTouches;
        }
    }

    public DeviceCacheStats stats() {
        synchronized (lock) {
            Map<String, Integer> perDevice = new TreeMap<>();
            deviceIndex.forEach((deviceId, points) -> perDevice.put(deviceId, points.size()));
            long lookups = totalHits + totalMisses;
            return DeviceCacheStats.builder()
                    .entryCount(entries.size())
                    .maxSize(maxSize)
                    .ttlSeconds(ttl.toMillis() / 1000.0)
                    .devicesTracked(deviceIndex.size())
                    .perDeviceCounts(perDevice)
                    .totalPuts(totalPuts)
                    .totalHits(totalHits)
                    .totalMisses(totalMisses)
                    .totalEvictions(totalEvictions)
                    .totalExpirations(totalExpirations)
                    .totalInvalidations(totalInvalidations)
                    .hitRate(lookups > 0 ? totalHits * 100.0 / lookups : 0.0)
                    .build();
        }
    }

    private void evictOldestLocked() {
        Iterator<PointKey> iterator = entries.keySet().iterator();
        PointKey oldest = iterator.next();
        iterator.remove();
        unindexLocked(oldest, OP_PUT);
        totalEvictions++;
        log.debug("缓存已满，淘汰条目: {}", oldest);
    }

    private void purgeExpiredHeadLocked(Instant now) {
        Iterator<CacheEntry<V>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            CacheEntry<V> entry = iterator.next();
            if (!entry.isExpired(now)) {
                break;
            }
            iterator.remove();
            unindexLocked(entry.key(), OP_PUT);
            totalExpirations++;
        }
    }

    private int purgeAllExpiredLocked(Instant now) {
        int purged = 0;
        Iterator<CacheEntry<V>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            CacheEntry<V> entry = iterator.next();
            if (entry.isExpired(now)) {
                iterator.remove();
                unindexLocked(entry.key(), "cache_purge");
                totalExpirations++;
                purged++;
            }
        }
        return purged;
    }

    private void removeLocked(PointKey key, String operation) {
        entries.remove(key);
        unindexLocked(key, operation);
    }

    private void unindexLocked(PointKey key, String operation) {
        Set<Integer> points = deviceIndex.get(key.deviceId());
        if (points == null || !points.remove(key.pointIndex())) {
            throw new InvariantViolationException("缓存条目未登记到设备索引",
                    key.deviceId(), operation, key.pointIndex());
        }
        if (points.isEmpty()) {
            deviceIndex.remove(key.deviceId());
        }
    }
}
