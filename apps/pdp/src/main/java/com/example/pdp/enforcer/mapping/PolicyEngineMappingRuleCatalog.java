package com.example.pdp.enforcer.mapping;

import com.example.pdp.config.properties.MappingRulesProperties;
import com.example.pdp.engine.EngineResult;
import com.example.pdp.engine.PolicyEngineClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Mapping rules read from the engine's {@code mapping_rules} document, whose {@code all} member
 * lists every rule. The list is cached for the configured refresh interval; failed reads are not cached.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pdp.mapping-rules.source", havingValue = "policy-engine")
public class PolicyEngineMappingRuleCatalog implements MappingRuleCatalog {

    static final String DOCUMENT_PATH = "mapping_rules";

    private final Mono<List<MappingRule>> cachedRules;

    public PolicyEngineMappingRuleCatalog(
            PolicyEngineClient engineClient,
            MappingRulesProperties properties,
            ObjectMapper objectMapper) {
        Duration ttl = properties.refreshInterval();
        this.cachedRules = engineClient.document(DOCUMENT_PATH)
                .flatMap(result -> toRules(result, objectMapper))
                .cache(rules -> ttl, error -> Duration.ZERO, () -> Duration.ZERO);
    }

    @Override
    public Mono<List<MappingRule>> rules() {
        return cachedRules.onErrorResume(e -> {
            log.warn("Cannot load mapping rules from policy engine: {}", e.getMessage());
            return Mono.just(List.of());
        });
    }

    private Mono<List<MappingRule>> toRules(EngineResult result, ObjectMapper objectMapper) {
        if (result instanceof EngineResult.Failure failure) {
            return Mono.error(new IllegalStateException(failure.kind() + ": " + failure.message()));
        }
        JsonNode all = ((EngineResult.Success) result).result().path("all");
        if (!all.isArray()) {
            return Mono.just(List.of());
        }
        List<MappingRule> rules = new ArrayList<>(all.size());
        for (JsonNode node : all) {
            try {
                rules.add(objectMapper.treeToValue(node, MappingRule.class));
            } catch (Exception e) {
                log.warn("Skipping malformed mapping rule: {}", e.getMessage());
            }
        }
        log.debug("Loaded {} mapping rules from policy engine", rules.size());
        return Mono.just(List.copyOf(rules));
    }
}
