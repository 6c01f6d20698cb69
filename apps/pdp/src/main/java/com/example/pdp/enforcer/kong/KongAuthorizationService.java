package com.example.pdp.enforcer.kong;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.config.properties.KongProperties;
import com.example.pdp.enforcer.model.AuthorizationQuery;
import com.example.pdp.enforcer.model.CacheDirectives;
import com.example.pdp.enforcer.model.QueryType;
import com.example.pdp.enforcer.model.Resource;
import com.example.pdp.enforcer.model.User;
import com.example.pdp.enforcer.service.AuthorizationRouter;
import com.example.pdp.observability.metrics.DecisionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a Kong request into a single check: the consumer is the user, the route table gives the
 * resource type and the lowercased HTTP method is the action.
 */
@Slf4j
@Service
public class KongAuthorizationService {

    static final String DEFAULT_TENANT = "default";

    private final KongRouteTable routeTable;
    private final AuthorizationRouter router;
    private final DecisionMetrics metrics;
    private final boolean debug;

    public KongAuthorizationService(
            KongRouteTable routeTable,
            AuthorizationRouter router,
            DecisionMetrics metrics,
            KongProperties properties) {
        this.routeTable = routeTable;
        this.router = router;
        this.metrics = metrics;
        this.debug = properties.debug();
    }

    @NonNull
    public Mono<KongAuthorizationResult> isAllowed(@NonNull KongAuthorizationQuery query) {
        KongAuthorizationQuery.Input input = query.input();
        KongAuthorizationQuery.Http http = input.request().http();

        if (debug) {
            log.info("Kong input: method={}, path={}, consumer={}",
                    StringSanitizer.forLog(http.method()),
                    StringSanitizer.forLog(http.path()),
                    input.consumer() != null ? StringSanitizer.forLog(input.consumer().username()) : null);
        }

        if (input.consumer() == null || input.consumer().username() == null || input.consumer().username().isBlank()) {
            log.warn("Kong request to {} has no consumer, denying", StringSanitizer.forLog(http.path()));
            return deny();
        }

        Optional<String> resourceType = routeTable.resolveResource(http.path());
        if (resourceType.isEmpty()) {
            log.warn("No Kong route matches {}, denying", StringSanitizer.forLog(http.path()));
            return deny();
        }

        AuthorizationQuery check = new AuthorizationQuery(
                User.of(input.consumer().username()),
                http.method().toLowerCase(Locale.ROOT),
                new Resource(resourceType.get(), null, DEFAULT_TENANT, Map.of(), Map.of()),
                Map.of(),
                null);

        return router.checkAllowed(QueryType.KONG, check, CacheDirectives.DEFAULT)
                .map(result -> new KongAuthorizationResult(result.allow()))
                .doOnNext(result -> {
                    if (debug) {
                        log.info("Kong decision: {} -> {}", StringSanitizer.forLog(check.describe()), result.result());
                    }
                });
    }

    private Mono<KongAuthorizationResult> deny() {
        metrics.recordDecision(QueryType.KONG.tag(), false);
        return Mono.just(KongAuthorizationResult.denied());
    }
}
