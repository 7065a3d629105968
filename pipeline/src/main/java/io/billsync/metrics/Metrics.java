package io.billsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin facade over a Dropwizard registry. Stages only ever bump counters, so that is all this exposes.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public static Metrics detached() { return new Metrics(new MetricRegistry()); }

    public void inc(String name) { registry.counter(name).inc(); }

    public void inc(String name, long n) { registry.counter(name).inc(n); }

    public long count(String name) { return registry.counter(name).getCount(); }

    /**
     * One-line "name=count" rendering of every counter whose name starts with prefix, in name order.
     */
    public String summary(String prefix) {
        StringJoiner out = new StringJoiner(" ");
        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
            if (e.getKey().startsWith(prefix)) {
                out.add(e.getKey() + "=" + e.getValue().getCount());
            }
        }
        return out.toString();
    }
}
