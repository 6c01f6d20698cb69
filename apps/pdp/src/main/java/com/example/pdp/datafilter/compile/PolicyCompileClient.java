package com.example.pdp.datafilter.compile;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.datafilter.rego.QuerySet;
import com.example.pdp.datafilter.rego.RegoParseException;
import com.example.pdp.engine.EngineResult;
import com.example.pdp.engine.PolicyEngineClient;
import com.example.pdp.exception.PolicyEngineUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partially evaluates the permit policy with the resource left unknown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyCompileClient {

    public static final String DEFAULT_QUERY = "data.permit.partial_eval.allow == true";

    public static final List<String> UNKNOWNS = List.of(
            "input.resource.key",
            "input.resource.tenant",
            "input.resource.attributes");

    private final PolicyEngineClient engineClient;

    @NonNull
    public Mono<QuerySet> compile(@NonNull FilterResourcesRequest request) {
        return compile(DEFAULT_QUERY, request);
    }

    /**
     * @throws PolicyEngineUnavailableException (signalled) when the engine cannot answer
     * @throws RegoParseException (signalled) when the answer is not a query set or not JSON at all
     */
    @NonNull
    public Mono<QuerySet> compile(@NonNull String query, @NonNull FilterResourcesRequest request) {
        Map<String, Object> compileRequest = new LinkedHashMap<>();
        compileRequest.put("query", query);
        compileRequest.put("input", input(request));
        compileRequest.put("unknowns", UNKNOWNS);

        log.debug("Compiling {} for ({}, {}, {})", query,
                StringSanitizer.forLog(request.user().key()),
                StringSanitizer.forLog(request.action()),
                StringSanitizer.forLog(request.resource().type()));

        return engineClient.compile(compileRequest)
                .flatMap(result -> {
                    if (result instanceof EngineResult.Success success) {
                        return Mono.fromCallable(() -> QuerySet.parse(success.result()));
                    }
                    EngineResult.Failure failure = (EngineResult.Failure) result;
                    if (failure.kind() == EngineResult.Kind.MALFORMED_RESPONSE) {
                        return Mono.error(new RegoParseException("Unreadable compile response: " + failure.message()));
                    }
                    return Mono.error(new PolicyEngineUnavailableException(failure));
                });
    }

    private static Map<String, Object> input(FilterResourcesRequest request) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("user", request.user());
        input.put("action", request.action());
        input.put("resource", Map.of("type", request.resource().type()));
        input.put("context", request.context());
        // debug rules would otherwise show up in the residual policy
        input.put("use_debugger", false);
        return input;
    }
}
