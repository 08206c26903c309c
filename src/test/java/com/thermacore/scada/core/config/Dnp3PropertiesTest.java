package com.thermacore.scada.core.config;

import com.thermacore.scada.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Dnp3PropertiesTest {

    @Test
    void defaultsAreValid() {
        Dnp3Properties properties = new Dnp3Properties();

        properties.validate();

        assertEquals(20, properties.getMaxConnections());
        assertEquals(Duration.ofSeconds(300), properties.connectionTtl());
        assertEquals(1024, properties.getCacheMaxSize());
        assertEquals(Duration.ofSeconds(2), properties.cacheTtl());
        assertEquals(1000, properties.getMetricsMaxHistory());
        assertEquals(Duration.ofSeconds(5), properties.readTimeout());
        assertTrue(properties.isCachingEnabled());
        assertTrue(properties.isBulkOperationsEnabled());
    }

    @Test
    void fractionalTtlKeepsMillisecondPrecision() {
        Dnp3Properties properties = new Dnp3Properties();
        properties.setCacheTtlSeconds(0.25);

        assertEquals(Duration.ofMillis(250), properties.cacheTtl());
    }

    @Test
    void nonPositiveValuesAreRejected() {
        Dnp3Properties zeroPool = new Dnp3Properties();
        zeroPool.setMaxConnections(0);
        ConfigurationException ex = assertThrows(ConfigurationException.class, zeroPool::validate);
        assertEquals("max-connections", ex.getProperty());

        Dnp3Properties negativeTtl = new Dnp3Properties();
        negativeTtl.setConnectionTtlSeconds(-1);
        assertThrows(ConfigurationException.class, negativeTtl::validate);

        Dnp3Properties zeroHistory = new Dnp3Properties();
        zeroHistory.setMetricsMaxHistory(0);
        assertThrows(ConfigurationException.class, zeroHistory::validate);
    }

    @Test
    void bindsFromKebabCaseProperties() {
        Map<String, String> source = Map.of(
                "thermacore.dnp3.max-connections", "8",
                "thermacore.dnp3.cache-ttl-seconds", "1.5",
                "thermacore.dnp3.caching-enabled", "false",
                "thermacore.dnp3.read-timeout-ms", "750");

        Dnp3Properties properties = new Binder(new MapConfigurationPropertySource(source))
                .bind("thermacore.dnp3", Dnp3Properties.class)
                .get();

        assertEquals(8, properties.getMaxConnections());
        assertEquals(Duration.ofMillis(1500), properties.cacheTtl());
        assertFalse(properties.isCachingEnabled());
        assertEquals(Duration.ofMillis(750), properties.readTimeout());
        assertEquals(1024, properties.getCacheMaxSize());
    }
}
