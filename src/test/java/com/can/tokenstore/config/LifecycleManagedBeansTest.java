package com.can.tokenstore.config;

import com.can.tokenstore.core.MemoryTokenStore;
import com.can.tokenstore.metric.MetricsReporter;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class LifecycleManagedBeansTest {

    @Inject
    MetricsReporter reporter;

    @Inject
    MemoryTokenStore store;

    @Inject
    AppProperties properties;

    @Test
    void metricsReporterPreDestroyStopsScheduling() {
        assertTrue(reporter.isRunning());
        reporter.close();
        assertFalse(reporter.isRunning());
        reporter.start(properties.metrics().reportIntervalSeconds());
        assertTrue(reporter.isRunning());
    }

    @Test
    void defaultStoreUsesPropertyDefaults() {
        assertEquals(100, store.collectThreshold());
        assertEquals(Duration.ofMinutes(10), store.expiration());
        store.set("lifecycle", "42");
        assertEquals("42", store.get("lifecycle", true));
    }
}
