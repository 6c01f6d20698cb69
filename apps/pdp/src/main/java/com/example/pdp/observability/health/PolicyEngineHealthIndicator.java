package com.example.pdp.observability.health;

import com.example.pdp.config.PolicyEngineWebClientConfig;
import com.example.pdp.config.properties.PolicyEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the local policy engine.
 */
@Slf4j
@Component
public class PolicyEngineHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final String engineUrl;

    public PolicyEngineHealthIndicator(
            @Qualifier(PolicyEngineWebClientConfig.POLICY_ENGINE_WEBCLIENT) WebClient webClient,
            PolicyEngineProperties properties) {
        this.webClient = webClient;
        this.engineUrl = properties.url();
    }

    @Override
    public Mono<Health> health() {
        return webClient.get()
                .uri("/health")
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .map(response -> Health.up()
                        .withDetail("url", engineUrl)
                        .build())
                .onErrorResume(error -> {
                    log.warn("Policy engine health check failed: {}", error.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("url", engineUrl)
                            .withDetail("error", String.valueOf(error.getMessage()))
                            .build());
                });
    }
}
