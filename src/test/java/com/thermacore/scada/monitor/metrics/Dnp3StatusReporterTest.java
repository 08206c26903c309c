package com.thermacore.scada.monitor.metrics;

import com.thermacore.scada.core.config.Dnp3Properties;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Device;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Service;
import com.thermacore.scada.support.FakeDnp3Master;
import com.thermacore.scada.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Dnp3StatusReporterTest {

    private MutableClock clock;
    private Dnp3Service service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        Dnp3Properties properties = new Dnp3Properties();
        properties.setConnectionTtlSeconds(60);
        service = new Dnp3Service(properties, new FakeDnp3Master(clock), clock);
        service.init();
        service.addDevice(Dnp3Device.builder().deviceId("D1").host("127.0.0.1").build());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void reportPurgesExpiredConnectionsAndCacheEntries() {
        service.connect("D1");
        service.read("D1", 1);
        clock.advanceMillis(60_000);

        new Dnp3StatusReporter(service).report();

        assertEquals(0, service.getConnectionPool().stats().getActiveCount());
        assertEquals(1, service.getConnectionPool().stats().getTotalExpired());
        assertEquals(0, service.getDataCache().size());
        service.getDataCache().verifyConsistency();
    }

    @Test
    void reportIsSkippedWhenServiceStopped() {
        service.connect("D1");
        service.shutdown();

        new Dnp3StatusReporter(service).report();

        assertEquals(0, service.getConnectionPool().stats().getTotalExpired());
    }
}
