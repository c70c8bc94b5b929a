package com.can.tokenstore.metric;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Süpürme gibi kritik bölüm sürelerini toplayan zamanlayıcıdır. Çağrı sayısı,
 * toplam süre ve gözlenen en uzun süre tutulur.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private final AtomicLong maxNs = new AtomicLong();

    public Timer(String name) { this.name = name; }

    public void record(long durationNs)
    {
        if (durationNs < 0) {
            return;
        }
        count.increment();
        totalNs.add(durationNs);
        maxNs.accumulateAndGet(durationNs, Math::max);
    }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        return new Sample(name, c, t, avg, maxNs.get());
    }

    /**
     * Anlık zamanlayıcı değerlerini taşıyan değişmez kayıt.
     */
    public record Sample(String name, long count, long totalNs, double avgNs, long maxNs) {}
}
