package com.can.tokenstore.metric;

import com.can.tokenstore.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Depo metriklerini belirli aralıklarla log'a yazan servistir. Vert.x
 * periyodik zamanlayıcısı ile tetiklenir, yazma işi worker havuzunda yapılır.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor) {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx, workerExecutor);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx, WorkerExecutor workerExecutor) {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init() {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds) {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                workerExecutor.executeBlocking(promise -> {
                    dump();
                    promise.complete();
                })
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    void dump() {
        new TreeMap<>(registry.counters()).values().forEach(counter ->
                LOG.infof("counter %s = %d", counter.name(), counter.get())
        );
        for (Map.Entry<String, Timer> e : new TreeMap<>(registry.timers()).entrySet()) {
            Timer.Sample sample = e.getValue().snapshot();
            LOG.infof("timer %s count=%d avg=%.2fus max=%.2fus",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.maxNs() / 1_000.0);
        }
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
