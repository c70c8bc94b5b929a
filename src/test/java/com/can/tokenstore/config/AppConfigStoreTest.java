package com.can.tokenstore.config;

import com.can.tokenstore.core.MemoryTokenStore;
import com.can.tokenstore.core.TokenStore;
import com.can.tokenstore.metric.MetricsRegistry;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
@TestProfile(AppConfigStoreTest.FastExpiryProfile.class)
class AppConfigStoreTest {

    @Inject
    TokenStore tokenStore;

    @Inject
    MemoryTokenStore memoryStore;

    @Inject
    MetricsRegistry metrics;

    @Nested
    class ConfiguredStore {
        /**
         * Profilde verilen eşik ve süre AppConfig tarafından depoya aktarılır.
         */
        @Test
        void storeUsesConfiguredThresholdAndExpiration() {
            assertSame(memoryStore, tokenStore);
            assertEquals(2, memoryStore.collectThreshold());
            assertEquals(Duration.ofMillis(50), memoryStore.expiration());
        }

        /**
         * Eşik aşıldığında süpürme worker havuzunda çalışır ve süresi dolan kayıtları siler.
         */
        @Test
        void backgroundSweepEvictsExpiredTokens() throws InterruptedException {
            tokenStore.set("wired-a", "1");
            tokenStore.set("wired-b", "2");
            Thread.sleep(100);
            tokenStore.set("wired-c", "3");

            long deadline = System.currentTimeMillis() + 2_000;
            while (!tokenStore.get("wired-a", false).isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals("", tokenStore.get("wired-a", false));
            assertEquals("", tokenStore.get("wired-b", false));
            assertTrue(metrics.counter("token_store_sweeps").get() >= 1);
            assertTrue(metrics.counter("token_store_evictions").get() >= 2);
        }
    }

    public static class FastExpiryProfile implements QuarkusTestProfile {

        public FastExpiryProfile() {
        }

        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "app.store.collect-threshold", "2",
                    "app.store.expiration-millis", "50",
                    "app.metrics.report-interval-seconds", "0"
            );
        }
    }
}
