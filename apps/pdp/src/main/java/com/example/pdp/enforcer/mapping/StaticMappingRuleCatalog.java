package com.example.pdp.enforcer.mapping;

import com.example.pdp.config.properties.MappingRulesProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Mapping rules read once at startup from a JSON file.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pdp.mapping-rules.source", havingValue = "static", matchIfMissing = true)
public class StaticMappingRuleCatalog implements MappingRuleCatalog {

    private static final TypeReference<List<MappingRule>> RULE_LIST = new TypeReference<>() {};

    private final List<MappingRule> rules;

    @Autowired
    public StaticMappingRuleCatalog(MappingRulesProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.rules = load(resourceLoader.getResource(properties.path()), objectMapper);
        log.info("Loaded {} mapping rules from {}", rules.size(), properties.path());
    }

    public StaticMappingRuleCatalog(List<MappingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public Mono<List<MappingRule>> rules() {
        return Mono.just(rules);
    }

    private static List<MappingRule> load(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("Mapping rules file {} not found, URL checks will not match any rule", resource.getDescription());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<MappingRule> loaded = objectMapper.readValue(in, RULE_LIST);
            return loaded != null ? List.copyOf(loaded) : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read mapping rules from " + resource.getDescription(), e);
        }
    }
}
