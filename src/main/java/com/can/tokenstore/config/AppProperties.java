package com.can.tokenstore.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * biçimde okuyan yapılandırma arayüzüdür. Token deposunun süpürme eşiği, son
 * kullanma süresi ve metrik raporlama sıklığı buradan gelir.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Store store();
    Metrics metrics();

    interface Store {
        @WithDefault("100")
        int collectThreshold();

        @WithDefault("600000")
        long expirationMillis();

        @WithDefault("1")
        int sweepWorkerPoolSize();
    }

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }
}
