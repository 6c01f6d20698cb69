package com.example.pdp.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decision, engine and cache metrics.
 * Tag values are bounded: query types, engine failure kinds and fixed outcomes only.
 */
@Component
public class DecisionMetrics {

    private static final String TAG_UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Timer engineTimerSuccess;
    private final Timer engineTimerFailure;

    public DecisionMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.engineTimerSuccess = Timer.builder("pdp.engine.request")
                .tag("outcome", "success")
                .description("Policy engine request latency")
                .register(registry);

        this.engineTimerFailure = Timer.builder("pdp.engine.request")
                .tag("outcome", "failure")
                .description("Policy engine request latency")
                .register(registry);
    }

    public void recordDecision(@NonNull String queryType, boolean allowed) {
        counter("pdp.decision", "Authorization decisions",
                "type", queryType, "result", allowed ? "allow" : "deny").increment();
    }

    public void recordFallback(@NonNull String queryType, @Nullable String failureKind) {
        counter("pdp.engine.failure", "Decisions answered with a fallback because the engine failed",
                "type", queryType, "kind", failureKind != null ? failureKind : TAG_UNKNOWN).increment();
    }

    public void recordCacheHit(@NonNull String queryType) {
        counter("pdp.cache", "Decision cache lookups", "type", queryType, "result", "hit").increment();
    }

    public void recordCacheMiss(@NonNull String queryType) {
        counter("pdp.cache", "Decision cache lookups", "type", queryType, "result", "miss").increment();
    }

    public void recordEngineCall(@NonNull Duration duration, boolean success) {
        (success ? engineTimerSuccess : engineTimerFailure).record(duration);
    }

    public double count(@NonNull String name, @NonNull String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + String.join(":", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry));
    }
}
