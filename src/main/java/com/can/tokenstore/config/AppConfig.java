package com.can.tokenstore.config;

import com.can.tokenstore.core.MemoryTokenStore;
import com.can.tokenstore.metric.MetricsRegistry;
import io.quarkus.arc.DefaultBean;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı token deposunu, metrik kayıt
 * defterini ve süpürme görevlerinin çalıştığı worker havuzunu üretir. Değerler
 * {@link AppProperties} üzerinden okunur. Depo {@link DefaultBean} olarak
 * üretildiği için uygulama kendi {@code TokenStore} bean'ini tanımlayarak onu
 * devre dışı bırakabilir.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);
    static final String SWEEPER_POOL = "token-store-sweeper";

    private final AppProperties properties;
    private final AtomicBoolean ownsVertx = new AtomicBoolean(false);

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    @DefaultBean
    public Vertx vertx()
    {
        ownsVertx.set(true);
        return Vertx.vertx();
    }

    void disposeVertx(@Disposes Vertx vertx)
    {
        if (ownsVertx.get()) {
            vertx.close().toCompletionStage().toCompletableFuture().join();
        }
    }

    @Produces
    @Singleton
    public WorkerExecutor sweeperExecutor(Vertx vertx)
    {
        int poolSize = Math.max(1, properties.store().sweepWorkerPoolSize());
        return vertx.createSharedWorkerExecutor(SWEEPER_POOL, poolSize);
    }

    void disposeSweeperExecutor(@Disposes WorkerExecutor executor)
    {
        executor.close();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    @DefaultBean
    public MemoryTokenStore tokenStore(MetricsRegistry metrics, WorkerExecutor sweeperExecutor)
    {
        var storeProps = properties.store();
        Executor sweeps = task -> sweeperExecutor.executeBlocking(() -> {
            task.run();
            return null;
        }, false);
        MemoryTokenStore store = MemoryTokenStore.builder()
                .collectThreshold(storeProps.collectThreshold())
                .expiration(Duration.ofMillis(storeProps.expirationMillis()))
                .sweepExecutor(sweeps)
                .metrics(metrics)
                .build();
        LOG.infof("Token store ready: collect-threshold=%d, expiration=%s",
                store.collectThreshold(), store.expiration());
        return store;
    }
}
