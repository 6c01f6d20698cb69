package com.example.pdp.datafilter.compile;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.datafilter.expression.BooleanExpressionTranslator;
import com.example.pdp.datafilter.expression.ResidualPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Residual policy for a (user, action, resource type): compile, parse, translate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataFilterService {

    private final PolicyCompileClient compileClient;
    private final BooleanExpressionTranslator translator;

    @NonNull
    public Mono<ResidualPolicy> filterResources(@NonNull FilterResourcesRequest request) {
        return compileClient.compile(request)
                .map(translator::translate)
                .doOnNext(policy -> log.info("Residual policy for ({}, {}, {}): {}",
                        StringSanitizer.forLog(request.user().key()),
                        StringSanitizer.forLog(request.action()),
                        StringSanitizer.forLog(request.resource().type()),
                        policy.type()));
    }
}
