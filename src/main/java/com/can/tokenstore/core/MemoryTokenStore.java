package com.can.tokenstore.core;

import com.can.tokenstore.metric.Counter;
import com.can.tokenstore.metric.MetricsRegistry;
import com.can.tokenstore.metric.Timer;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Token'ları bellekte tutan ve süresi dolanları tembel biçimde temizleyen
 * depodur. Kimlik-değer eşlemesi ile ekleme sırasını izleyen tahliye kuyruğu
 * tek bir okuma/yazma kilidi altında birlikte korunur. Ekleme sayısı eşiği
 * aştığında arka planda bir süpürme görevi başlatılır; görev kuyruğun başından
 * ilerler ve süresi dolmamış ilk düğümde durur.
 *
 * <p>Tüketen okuma yalnızca eşlemeden siler, kuyruktaki düğüm öksüz kalır ve
 * sonraki süpürmede zararsız biçimde atılır.</p>
 */
public final class MemoryTokenStore implements TokenStore
{
    private static final Logger LOG = Logger.getLogger(MemoryTokenStore.class);

    public static final int DEFAULT_COLLECT_THRESHOLD = 100;
    public static final Duration DEFAULT_EXPIRATION = Duration.ofMinutes(10);

    private static final String MISSING = "";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> index = new HashMap<>();
    private final ArrayDeque<QueueNode> queue = new ArrayDeque<>();
    private int liveCount; // guarded by lock

    private final int collectThreshold;
    private final Duration expiration;
    private final Clock clock;
    private final Executor sweepExecutor;

    private final Counter sets, hits, misses, consumed, sweeps, evictions; // nullable
    private final Timer tSweep;                                            // nullable

    private MemoryTokenStore(int collectThreshold, Duration expiration, Clock clock,
                             Executor sweepExecutor, MetricsRegistry metrics) {
        this.collectThreshold = collectThreshold;
        this.expiration = expiration;
        this.clock = clock;
        this.sweepExecutor = sweepExecutor;

        if (metrics != null) {
            this.sets = metrics.counter("token_store_sets");
            this.hits = metrics.counter("token_store_hits");
            this.misses = metrics.counter("token_store_misses");
            this.consumed = metrics.counter("token_store_consumed");
            this.sweeps = metrics.counter("token_store_sweeps");
            this.evictions = metrics.counter("token_store_evictions");
            this.tSweep = metrics.timer("token_store_sweep");
        } else {
            this.sets = this.hits = this.misses = this.consumed = this.sweeps = this.evictions = null;
            this.tSweep = null;
        }
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Deponun eşik, son kullanma süresi, saat ve arka plan yürütücüsü gibi
     * parametrelerini ayarlamaya yarayan akıcı yapılandırma sınıfıdır.
     */
    public static final class Builder
    {
        private int collectThreshold = DEFAULT_COLLECT_THRESHOLD;
        private Duration expiration = DEFAULT_EXPIRATION;
        private Clock clock = Clock.systemUTC();
        private Executor sweepExecutor = ForkJoinPool.commonPool();
        private MetricsRegistry metrics;

        private Builder() {}

        public Builder collectThreshold(int n){ this.collectThreshold = n; return this; }
        public Builder expiration(Duration d){ this.expiration = Objects.requireNonNull(d); return this; }
        public Builder clock(Clock c){ this.clock = Objects.requireNonNull(c); return this; }
        public Builder sweepExecutor(Executor e){ this.sweepExecutor = Objects.requireNonNull(e); return this; }
        public Builder metrics(MetricsRegistry m){ this.metrics = m; return this; }

        public MemoryTokenStore build() {
            if (collectThreshold < 0) {
                throw new IllegalArgumentException("collectThreshold must be >= 0: " + collectThreshold);
            }
            if (expiration.isZero() || expiration.isNegative()) {
                throw new IllegalArgumentException("expiration must be positive: " + expiration);
            }
            return new MemoryTokenStore(collectThreshold, expiration, clock, sweepExecutor, metrics);
        }
    }

    @Override
    public void set(String id, String value)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        int stored;
        lock.writeLock().lock();
        try {
            index.put(id, value);
            queue.addLast(new QueueNode(id, clock.instant()));
            stored = ++liveCount;
        } finally {
            lock.writeLock().unlock();
        }
        if (sets != null) sets.inc();
        // Decided outside the lock; concurrent callers may schedule redundant sweeps.
        if (stored > collectThreshold) {
            scheduleSweep(stored);
        }
    }

    @Override
    public String get(String id, boolean clear)
    {
        Objects.requireNonNull(id, "id");
        String value;
        if (!clear) {
            lock.readLock().lock();
            try {
                value = index.get(id);
            } finally {
                lock.readLock().unlock();
            }
        } else {
            lock.writeLock().lock();
            try {
                value = index.remove(id);
            } finally {
                lock.writeLock().unlock();
            }
        }
        if (value == null) {
            if (misses != null) misses.inc();
            return MISSING;
        }
        if (hits != null) hits.inc();
        if (clear && consumed != null) consumed.inc();
        return value;
    }

    /**
     * Kuyruğun başından başlayarak süresi dolmuş düğümleri ve karşılık gelen
     * eşlemeleri siler. Referans zaman geçişin başında bir kez alınır; süresi
     * dolmamış ilk düğümde geçiş sona erer.
     *
     * @return kuyruktan atılan düğüm sayısı (öksüz düğümler dahil)
     */
    int collect()
    {
        Instant now = clock.instant();
        long t0 = System.nanoTime();
        int evicted = 0;
        int remaining;
        lock.writeLock().lock();
        try {
            QueueNode head;
            while ((head = queue.peekFirst()) != null && head.expired(expiration, now)) {
                index.remove(head.id());
                queue.pollFirst();
                liveCount--;
                evicted++;
            }
            remaining = queue.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (tSweep != null) tSweep.record(System.nanoTime() - t0);
        if (sweeps != null) sweeps.inc();
        if (evicted > 0 && evictions != null) evictions.add(evicted);
        LOG.debugf("Token sweep evicted %d node(s), %d remaining in queue", evicted, remaining);
        return evicted;
    }

    private void scheduleSweep(int observedCount) {
        LOG.debugf("Scheduling token sweep, %d live insertion(s) over threshold %d", observedCount, collectThreshold);
        try {
            sweepExecutor.execute(this::safeCollect);
        } catch (RejectedExecutionException e) {
            LOG.warn("Token sweep rejected by executor, will retry on a later insertion", e);
        }
    }

    private void safeCollect() {
        try {
            collect();
        } catch (Throwable t) {
            LOG.error("Token sweep failed", t);
        }
    }

    /** Eşlemede bulunan kayıt sayısı. */
    public int size() {
        lock.readLock().lock();
        try { return index.size(); } finally { lock.readLock().unlock(); }
    }

    /** Öksüz düğümler dahil tahliye kuyruğunun uzunluğu. */
    public int queueLength() {
        lock.readLock().lock();
        try { return queue.size(); } finally { lock.readLock().unlock(); }
    }

    /** Süpürme tetiklemek için kullanılan tavsiye niteliğindeki sayaç. */
    public int liveCount() {
        lock.readLock().lock();
        try { return liveCount; } finally { lock.readLock().unlock(); }
    }

    public int collectThreshold() { return collectThreshold; }

    public Duration expiration() { return expiration; }
}
