package com.example.pdp.enforcer.kong;

import com.example.pdp.config.properties.KongProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered Kong routes, loaded once from a JSON list of {@code [regex, resource]} pairs where the
 * resource is a type name or a capture group index. The first matching route wins.
 */
@Slf4j
@Component
public class KongRouteTable {

    private final List<KongRoute> routes;

    @Autowired
    public KongRouteTable(KongProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.routes = properties.enabled()
                ? load(resourceLoader.getResource(properties.routesPath()), objectMapper)
                : List.of();
        if (properties.enabled()) {
            log.info("Loaded {} Kong routes from {}", routes.size(), properties.routesPath());
        }
    }

    public KongRouteTable(List<KongRoute> routes) {
        this.routes = List.copyOf(routes);
    }

    public Optional<String> resolveResource(String path) {
        for (KongRoute route : routes) {
            Optional<String> resource = route.resolve(path);
            if (resource.isPresent()) {
                return resource;
            }
        }
        return Optional.empty();
    }

    public int size() {
        return routes.size();
    }

    static List<KongRoute> parse(JsonNode root) {
        if (!root.isArray()) {
            throw new IllegalArgumentException("Kong routes must be a JSON list");
        }
        List<KongRoute> parsed = new ArrayList<>();
        for (JsonNode entry : root) {
            if (!entry.isArray() || entry.size() != 2 || !entry.get(0).isTextual()) {
                throw new IllegalArgumentException("Kong route must be a [regex, resource] pair, got: " + entry);
            }
            String regex = entry.get(0).asText();
            JsonNode resource = entry.get(1);
            try {
                if (resource.isTextual()) {
                    parsed.add(KongRoute.literal(regex, resource.asText()));
                } else if (resource.isInt()) {
                    parsed.add(KongRoute.group(regex, resource.asInt()));
                } else {
                    throw new IllegalArgumentException("Kong route resource must be a string or a group index, got: " + resource);
                }
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid Kong route regex: " + regex, e);
            }
        }
        return List.copyOf(parsed);
    }

    private static List<KongRoute> load(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("Kong routes file {} not found, every Kong request will be denied", resource.getDescription());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read Kong routes from " + resource.getDescription(), e);
        }
    }
}
