package com.example.pdp.observability.health;

import com.example.pdp.enforcer.statistics.DecisionStatisticsTracker;
import com.example.pdp.enforcer.statistics.StatisticsWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * DOWN once the engine failure rate has tripped the statistics tracker.
 */
@Component
@RequiredArgsConstructor
public class DecisionStatisticsHealthIndicator implements ReactiveHealthIndicator {

    private final DecisionStatisticsTracker statistics;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            StatisticsWindow window = statistics.snapshot();
            Health.Builder builder = window.tripped() ? Health.down() : Health.up();
            return builder
                    .withDetail("requests", window.requests())
                    .withDetail("failures", window.failures())
                    .withDetail("windowStart", window.windowStart().toString())
                    .withDetail("tripped", window.tripped())
                    .build();
        });
    }
}
