package com.can.tokenstore.metric;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları isimleriyle tutan paylaşılan kayıt defteridir.
 * Metrikler ilk talep edildiklerinde oluşturulur.
 */
public final class MetricsRegistry {
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters(){ return Map.copyOf(counters); }
    public Map<String, Timer> timers(){ return Map.copyOf(timers); }
}
