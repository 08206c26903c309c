package com.thermacore.scada.core.cache;

import com.thermacore.scada.common.exception.CapacityException;
import com.thermacore.scada.common.exception.ConfigurationException;
import com.thermacore.scada.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeviceDataCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
    }

    private DeviceDataCache<Double> newCache(int maxSize, long ttlMillis) {
        return new DeviceDataCache<>(maxSize, Duration.ofMillis(ttlMillis), true, clock);
    }

    @Test
    void putThenGetReturnsValueAndIndexesPoint() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);

        cache.put("D1", 5, 42.0);

        assertEquals(Optional.of(42.0), cache.get("D1", 5));
        assertEquals(Set.of(5), cache.indexedPoints("D1"));
        cache.verifyConsistency();
    }

    @Test
    void overwriteKeepsSingleEntryAndRestartsTtl() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);
        cache.put("D1", 5, 1.0);
        clock.advanceMillis(1_500);
        cache.put("D1", 5, 2.0);
        clock.advanceMillis(1_000);

        assertEquals(Optional.of(2.0), cache.get("D1", 5));
        assertEquals(1, cache.size());
        CacheEntry<Double> entry = cache.getEntry("D1", 5).orElseThrow();
        assertEquals(entry.capturedAt().plusMillis(2_000), entry.expiresAt());
    }

    @Test
    void entryExpiresExactlyAtTtl() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);
        cache.put("D1", 5, 42.0);

        clock.advanceMillis(1_999);
        assertTrue(cache.get("D1", 5).isPresent());

        clock.advanceMillis(1);
        assertFalse(cache.get("D1", 5).isPresent());
        assertTrue(cache.indexedPoints("D1").isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.stats().getTotalExpirations());
    }

    @Test
    void readsDoNotExtendTtl() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);
        cache.put("D1", 5, 42.0);

        clock.advanceMillis(1_500);
        assertTrue(cache.get("D1", 5).isPresent());
        clock.advanceMillis(500);

        assertFalse(cache.get("D1", 5).isPresent());
    }

    @Test
    void invalidateDeviceTouchesOnlyThatDevicesPoints() {
        DeviceDataCache<Double> cache = newCache(2_000, 60_000);
        for (int point = 0; point < 5; point++) {
            cache.put("D1", point, (double) point);
        }
        for (int device = 0; device < 199; device++) {
            for (int point = 0; point < 5; point++) {
                cache.put("other-" + device, point, 0.0);
            }
        }
        assertEquals(1_000, cache.size());

        int removed = cache.invalidateDevice("D1");

        assertEquals(5, removed);
        assertEquals(5, cache.getLastInvalidationTouched());
        assertEquals(5, cache.getTotalInvalidationTouches());
        assertEquals(995, cache.size());
        assertTrue(cache.indexedPoints("D1").isEmpty());
        assertTrue(cache.get("other-0", 0).isPresent());
        cache.verifyConsistency();
    }

    @Test
    void invalidateUnknownDeviceIsNoOp() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);
        cache.put("D1", 1, 1.0);

        assertEquals(0, cache.invalidateDevice("D2"));
        assertEquals(0, cache.getLastInvalidationTouched());
        assertEquals(1, cache.size());
    }

    @Test
    void invalidateSinglePoint() {
        DeviceDataCache<Double> cache = newCache(16, 2_000);
        cache.put("D1", 1, 1.0);
        cache.put("D1", 2, 2.0);

        assertTrue(cache.invalidate("D1", 1));
        assertFalse(cache.invalidate("D1", 1));

        assertEquals(Set.of(2), cache.indexedPoints("D1"));
        cache.verifyConsistency();
    }

    @Test
    void fullCacheEvictsEarliestExpiry() {
        DeviceDataCache<Double> cache = newCache(3, 10_000);
        cache.put("D1", 1, 1.0);
        clock.advanceMillis(10);
        cache.put("D1", 2, 2.0);
        clock.advanceMillis(10);
        cache.put("D2", 1, 3.0);
        clock.advanceMillis(10);
        // 覆盖写后 D1:1 成为最晚过期
        cache.put("D1", 1, 4.0);
        clock.advanceMillis(10);

        cache.put("D2", 2, 5.0);

        assertEquals(3, cache.size());
        assertFalse(cache.get("D1", 2).isPresent());
        assertEquals(Optional.of(4.0), cache.get("D1", 1));
        assertEquals(1, cache.stats().getTotalEvictions());
        cache.verifyConsistency();
    }

    @Test
    void fullCacheReclaimsExpiredEntriesBeforeEvicting() {
        DeviceDataCache<Double> cache = newCache(2, 1_000);
        cache.put("D1", 1, 1.0);
        clock.advanceMillis(500);
        cache.put("D1", 2, 2.0);
        clock.advanceMillis(600);

        cache.put("D1", 3, 3.0);

        assertEquals(0, cache.stats().getTotalEvictions());
        assertEquals(1, cache.stats().getTotalExpirations());
        assertEquals(Set.of(2, 3), cache.indexedPoints("D1"));
    }

    @Test
    void fullCacheWithoutEvictionRejectsNewKeys() {
        DeviceDataCache<Double> cache = new DeviceDataCache<>(2, Duration.ofSeconds(10), false, clock);
        cache.put("D1", 1, 1.0);
        cache.put("D1", 2, 2.0);

        assertThrows(CapacityException.class, () -> cache.put("D1", 3, 3.0));
        cache.put("D1", 2, 20.0);

        assertEquals(Optional.of(20.0), cache.get("D1", 2));
        assertEquals(2, cache.size());
    }

    @Test
    void randomizedOperationsKeepIndexConsistent() {
        DeviceDataCache<Double> cache = newCache(50, 1_000);
        Random random = new Random(42);

        for (int i = 0; i < 5_000; i++) {
            String deviceId = "D" + random.nextInt(8);
            int point = random.nextInt(20);
            int op = random.nextInt(10);
            if (op < 5) {
                cache.put(deviceId, point, random.nextDouble());
            } else if (op < 7) {
                cache.get(deviceId, point);
            } else if (op == 7) {
                cache.invalidate(deviceId, point);
            } else if (op == 8) {
                cache.invalidateDevice(deviceId);
            } else {
                cache.purgeExpired();
            }
            clock.advanceMillis(random.nextInt(50));
            if (i % 50 == 0) {
                cache.verifyConsistency();
            }
            assertTrue(cache.size() <= 50);
        }
        cache.verifyConsistency();
    }

    @Test
    void statsReportCountersAndHitRate() {
        DeviceDataCache<Double> cache = newCache(10, 2_000);
        cache.put("D1", 1, 1.0);
        cache.put("D1", 2, 2.0);
        cache.put("D2", 1, 3.0);
        cache.get("D1", 1);
        cache.get("D1", 9);

        DeviceCacheStats stats = cache.stats();
        assertEquals(3, stats.getEntryCount());
        assertEquals(10, stats.getMaxSize());
        assertEquals(2.0, stats.getTtlSeconds(), 1e-9);
        assertEquals(2, stats.getDevicesTracked());
        assertEquals(2, stats.getPerDeviceCounts().get("D1"));
        assertEquals(1, stats.getPerDeviceCounts().get("D2"));
        assertEquals(50.0, stats.getHitRate(), 1e-9);
    }

    @Test
    void clearDropsEntriesAndIndex() {
        DeviceDataCache<Double> cache = newCache(10, 2_000);
        cache.put("D1", 1, 1.0);
        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.indexedPoints("D1").isEmpty());
        cache.verifyConsistency();
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(ConfigurationException.class, () -> newCache(0, 1_000));
        assertThrows(ConfigurationException.class, () -> newCache(10, 0));
    }
}
