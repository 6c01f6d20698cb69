package com.example.pdp.engine;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.config.PolicyEngineWebClientConfig;
import com.example.pdp.config.properties.PolicyEngineProperties;
import com.example.pdp.engine.EngineResult.Failure;
import com.example.pdp.engine.EngineResult.Kind;
import com.example.pdp.engine.EngineResult.Success;
import com.example.pdp.observability.metrics.DecisionMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Non-blocking client for the policy engine's data and compile APIs.
 *
 * <p>Every call resolves to an {@link EngineResult}; transport errors, timeouts, non-2xx
 * statuses and unparseable bodies become {@link Failure} values with a distinct {@link Kind}.</p>
 */
@Slf4j
@Component
public class PolicyEngineClient {

    public static final String SERVICE_NAME = "policy-engine";

    private static final String DATA_PATH = "/v1/data/";
    private static final String COMPILE_PATH = "/v1/compile";

    private final WebClient webClient;
    private final PolicyEngineProperties properties;
    private final ObjectMapper objectMapper;
    private final DecisionMetrics metrics;

    public PolicyEngineClient(
            @Qualifier(PolicyEngineWebClientConfig.POLICY_ENGINE_WEBCLIENT) WebClient webClient,
            PolicyEngineProperties properties,
            ObjectMapper objectMapper,
            DecisionMetrics metrics) {
        this.webClient = webClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Evaluates the document at {@code packagePath}, e.g. {@code permit/root}, with the given input.
     */
    @NonNull
    public Mono<EngineResult> query(@NonNull String packagePath, @NonNull Object input) {
        String uri = DATA_PATH + stripLeadingSlash(packagePath);
        return call(uri, webClient.post()
                .uri(uri)
                .bodyValue(Map.of("input", input)));
    }

    /**
     * Reads a data document without input, e.g. {@code mapping_rules}.
     */
    @NonNull
    public Mono<EngineResult> document(@NonNull String packagePath) {
        String uri = DATA_PATH + stripLeadingSlash(packagePath);
        return call(uri, webClient.get().uri(uri));
    }

    /**
     * Runs partial evaluation. A successful result holds {@code queries} and {@code support}.
     */
    @NonNull
    public Mono<EngineResult> compile(@NonNull Map<String, Object> request) {
        return call(COMPILE_PATH, webClient.post()
                .uri(COMPILE_PATH)
                .bodyValue(request));
    }

    private Mono<EngineResult> call(String uri, WebClient.RequestHeadersSpec<?> request) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return request
                    .exchangeToMono(this::readResponse)
                    .timeout(properties.timeout())
                    .onErrorResume(TimeoutException.class, e -> Mono.just(
                            new Failure(Kind.TIMEOUT, "Policy engine did not answer within " + properties.timeout())))
                    .onErrorResume(e -> Mono.just(new Failure(Kind.CONNECTION, describe(e))))
                    .doOnNext(result -> {
                        boolean success = result instanceof Success;
                        metrics.recordEngineCall(Duration.ofNanos(System.nanoTime() - start), success);
                        if (result instanceof Failure failure) {
                            log.warn("Policy engine call to {} failed: kind={}, reason={}",
                                    uri, failure.kind(), StringSanitizer.forLog(failure.message(), 256));
                        } else {
                            log.debug("Policy engine call to {} succeeded", uri);
                        }
                    });
        });
    }

    private Mono<EngineResult> readResponse(ClientResponse response) {
        if (!response.statusCode().is2xxSuccessful()) {
            int status = response.statusCode().value();
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> (EngineResult) new Failure(Kind.BAD_STATUS,
                            "Policy engine returned status " + status + ": " + body));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(this::parseBody);
    }

    private EngineResult parseBody(String body) {
        if (body.isBlank()) {
            return new Failure(Kind.MALFORMED_RESPONSE, "Policy engine returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                return new Failure(Kind.MALFORMED_RESPONSE, "Policy engine response is not a JSON object");
            }
            JsonNode result = root.get("result");
            return new Success(result != null ? result : MissingNode.getInstance());
        } catch (JsonProcessingException e) {
            return new Failure(Kind.MALFORMED_RESPONSE, "Cannot decode policy engine response: " + e.getOriginalMessage());
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
