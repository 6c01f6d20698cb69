package com.example.pdp.enforcer.service;

import com.example.pdp.common.util.CacheKeyUtils;
import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.config.properties.DecisionCacheProperties;
import com.example.pdp.engine.EngineResult;
import com.example.pdp.engine.EngineResult.Failure;
import com.example.pdp.engine.EngineResult.Success;
import com.example.pdp.engine.PolicyEngineClient;
import com.example.pdp.enforcer.cache.DecisionCache;
import com.example.pdp.enforcer.log.DecisionLogService;
import com.example.pdp.enforcer.mapping.MappingRule;
import com.example.pdp.enforcer.mapping.MappingRuleCatalog;
import com.example.pdp.enforcer.mapping.MappingRuleMatcher;
import com.example.pdp.enforcer.model.AllTenantsAuthorizationResult;
import com.example.pdp.enforcer.model.AuthorizationQuery;
import com.example.pdp.enforcer.model.AuthorizationResult;
import com.example.pdp.enforcer.model.BulkAuthorizationQuery;
import com.example.pdp.enforcer.model.BulkAuthorizationResult;
import com.example.pdp.enforcer.model.CacheDirectives;
import com.example.pdp.enforcer.model.QueryType;
import com.example.pdp.enforcer.model.Resource;
import com.example.pdp.enforcer.model.UrlAuthorizationQuery;
import com.example.pdp.enforcer.model.UserPermissionsQuery;
import com.example.pdp.enforcer.model.UserTenantsQuery;
import com.example.pdp.enforcer.statistics.DecisionStatisticsTracker;
import com.example.pdp.observability.filter.CorrelationIdFilter;
import com.example.pdp.observability.metrics.DecisionMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decision pipeline behind the enforcer endpoints.
 *
 * <p>Each operation builds the engine input, consults the decision cache, calls the policy engine
 * and shapes the engine result into the response. When the engine call fails the operation
 * answers with its typed fallback instead of an error; the failure is reported to the statistics
 * tracker, counted and logged.</p>
 */
@Slf4j
@Service
public class AuthorizationRouter {

    static final String NO_MATCHING_RULE = "Matching mapping rule not found";
    static final String ENGINE_UNAVAILABLE = "policy engine unavailable";

    private final PolicyEngineClient engineClient;
    private final DecisionCache cache;
    private final DecisionStatisticsTracker statistics;
    private final DecisionLogService decisionLog;
    private final DecisionMetrics metrics;
    private final MappingRuleCatalog ruleCatalog;
    private final MappingRuleMatcher ruleMatcher;
    private final ObjectMapper objectMapper;

    public AuthorizationRouter(
            PolicyEngineClient engineClient,
            DecisionCache cache,
            DecisionStatisticsTracker statistics,
            DecisionLogService decisionLog,
            DecisionMetrics metrics,
            MappingRuleCatalog ruleCatalog,
            MappingRuleMatcher ruleMatcher,
            ObjectMapper objectMapper) {
        this.engineClient = engineClient;
        this.cache = cache;
        this.statistics = statistics;
        this.decisionLog = decisionLog;
        this.metrics = metrics;
        this.ruleCatalog = ruleCatalog;
        this.ruleMatcher = ruleMatcher;
        this.objectMapper = objectMapper;
    }

    @NonNull
    public Mono<AuthorizationResult> isAllowed(@NonNull AuthorizationQuery query, @NonNull CacheDirectives directives) {
        return checkAllowed(QueryType.ALLOWED, query, directives);
    }

    /**
     * Single check against {@code permit/root}, recorded under the given query type.
     */
    @NonNull
    public Mono<AuthorizationResult> checkAllowed(
            @NonNull QueryType type,
            @NonNull AuthorizationQuery query,
            @NonNull CacheDirectives directives) {

        String key = CacheKeyUtils.key(type.cachePrefix(), query, objectMapper);

        return evaluate(type, key, query, directives)
                .flatMap(evaluation -> CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    if (evaluation.result() instanceof Success success) {
                        AuthorizationResult result = shapeAllowed(query, success.result());
                        metrics.recordDecision(type.tag(), result.allow());
                        decisionLog.logDecision(type, query.describe(), result.allow(), evaluation.cached(),
                                query, result.debug(), correlationId);
                        return result;
                    }
                    Failure failure = (Failure) evaluation.result();
                    recordFallback(type, query.describe(), failure, query, correlationId);
                    return AuthorizationResult.denied();
                }));
    }

    @NonNull
    public Mono<BulkAuthorizationResult> isAllowedBulk(@NonNull BulkAuthorizationQuery query,
                                                        @NonNull CacheDirectives directives) {
        List<AuthorizationQuery> checks = query.checks();
        if (checks.isEmpty()) {
            return Mono.just(new BulkAuthorizationResult(List.of()));
        }

        List<String> keys = checks.stream()
                .map(check -> CacheKeyUtils.key(QueryType.BULK.cachePrefix(), check, objectMapper))
                .toList();

        return lookupAll(keys, directives)
                .flatMap(cached -> {
                    List<Integer> missed = new ArrayList<>();
                    for (int i = 0; i < checks.size(); i++) {
                        if (cached.get(i).isEmpty()) {
                            missed.add(i);
                        }
                    }
                    if (missed.isEmpty()) {
                        return Mono.just(new BulkEvaluation(cached, cachedIndexes(cached), null));
                    }
                    List<AuthorizationQuery> missedChecks = missed.stream().map(checks::get).toList();
                    return callEngine(QueryType.BULK, Map.of("checks", missedChecks))
                            .flatMap(result -> mergeBulk(result, cached, missed, keys, directives));
                })
                .flatMap(evaluation -> CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    List<AuthorizationResult> results = new ArrayList<>(checks.size());
                    for (int i = 0; i < checks.size(); i++) {
                        AuthorizationQuery check = checks.get(i);
                        Optional<JsonNode> decision = evaluation.decisions().get(i);
                        if (decision.isPresent()) {
                            AuthorizationResult result = shapeBulkEntry(decision.get());
                            metrics.recordDecision(QueryType.BULK.tag(), result.allow());
                            decisionLog.logDecision(QueryType.BULK, check.describe(), result.allow(),
                                    evaluation.cachedIndexes().contains(i), check, result.debug(), correlationId);
                            results.add(result);
                        } else {
                            Failure failure = evaluation.failure() != null ? evaluation.failure()
                                    : new Failure(EngineResult.Kind.MALFORMED_RESPONSE, "No decision for check " + i);
                            recordFallback(QueryType.BULK, check.describe(), failure, check, correlationId);
                            results.add(AuthorizationResult.denied(
                                    objectMapper.createObjectNode().put("error", ENGINE_UNAVAILABLE)));
                        }
                    }
                    return new BulkAuthorizationResult(results);
                }));
    }

    @NonNull
    public Mono<AllTenantsAuthorizationResult> isAllowedAllTenants(@NonNull AuthorizationQuery query,
                                                                    @NonNull CacheDirectives directives) {
        String key = CacheKeyUtils.key(QueryType.ALL_TENANTS.cachePrefix(), query, objectMapper);

        return evaluate(QueryType.ALL_TENANTS, key, query, directives)
                .flatMap(evaluation -> CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    if (evaluation.result() instanceof Success success) {
                        List<JsonNode> tenants = new ArrayList<>();
                        success.result().path("allowed_tenants").forEach(tenants::add);
                        boolean allowed = !tenants.isEmpty();
                        metrics.recordDecision(QueryType.ALL_TENANTS.tag(), allowed);
                        decisionLog.logDecision(QueryType.ALL_TENANTS, query.describe(), allowed, evaluation.cached(),
                                query, null, correlationId);
                        return new AllTenantsAuthorizationResult(tenants);
                    }
                    recordFallback(QueryType.ALL_TENANTS, query.describe(), (Failure) evaluation.result(), query, correlationId);
                    return AllTenantsAuthorizationResult.none();
                }));
    }

    /**
     * Resolves the URL to a resource and action through the mapping rules, then runs a single check.
     */
    @NonNull
    public Mono<AuthorizationResult> isAllowedUrl(@NonNull UrlAuthorizationQuery query,
                                                  @NonNull CacheDirectives directives) {
        return ruleCatalog.rules().flatMap(rules -> {
            Optional<MappingRule> match = ruleMatcher.match(query.httpMethod(), query.url(), rules);
            if (match.isEmpty()) {
                log.warn("No mapping rule for {} {}",
                        StringSanitizer.forLog(query.httpMethod()), StringSanitizer.forLog(query.url()));
                metrics.recordDecision(QueryType.URL.tag(), false);
                JsonNode debug = objectMapper.createObjectNode().put("reason", NO_MATCHING_RULE);
                String summary = "(" + query.user().key() + ", " + query.httpMethod() + " " + query.url() + ")";
                return CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    decisionLog.logDecision(QueryType.URL, summary, false, false, query, debug, correlationId);
                    return AuthorizationResult.denied(debug);
                });
            }

            MappingRule rule = match.get();
            Map<String, Object> attributes = new LinkedHashMap<>(ruleMatcher.extractAttributes(rule, query.url()));
            AuthorizationQuery check = new AuthorizationQuery(
                    query.user(),
                    rule.resourceAction(),
                    new Resource(rule.resource(), null, query.tenant(), attributes, Map.of()),
                    query.context(),
                    query.sdk());

            log.debug("Mapped {} {} to ({}, {})",
                    StringSanitizer.forLog(query.httpMethod()), StringSanitizer.forLog(query.url()),
                    rule.resource(), rule.resourceAction());
            return checkAllowed(QueryType.URL, check, directives);
        });
    }

    /**
     * Permissions of the user, keyed by resource. The fallback is an empty object.
     */
    @NonNull
    public Mono<JsonNode> userPermissions(@NonNull UserPermissionsQuery query, @NonNull CacheDirectives directives) {
        String key = CacheKeyUtils.key(QueryType.USER_PERMISSIONS.cachePrefix(), query, objectMapper);
        String summary = "(" + query.user().key() + ", user_permissions)";

        return evaluate(QueryType.USER_PERMISSIONS, key, query, directives)
                .flatMap(evaluation -> CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    if (evaluation.result() instanceof Success success) {
                        JsonNode result = success.result();
                        JsonNode permissions = result.has("permissions") ? result.get("permissions") : result;
                        JsonNode body = permissions.isObject() ? permissions : objectMapper.createObjectNode();
                        boolean any = body.size() > 0;
                        metrics.recordDecision(QueryType.USER_PERMISSIONS.tag(), any);
                        decisionLog.logDecision(QueryType.USER_PERMISSIONS, summary, any, evaluation.cached(),
                                query, null, correlationId);
                        return body;
                    }
                    recordFallback(QueryType.USER_PERMISSIONS, summary, (Failure) evaluation.result(), query, correlationId);
                    return (JsonNode) objectMapper.createObjectNode();
                }));
    }

    /**
     * Tenants the user belongs to. The fallback is an empty list.
     */
    @NonNull
    public Mono<JsonNode> userTenants(@NonNull UserTenantsQuery query, @NonNull CacheDirectives directives) {
        String key = CacheKeyUtils.key(QueryType.USER_TENANTS.cachePrefix(), query, objectMapper);
        String summary = "(" + query.user().key() + ", user_tenants)";

        return evaluate(QueryType.USER_TENANTS, key, query, directives)
                .flatMap(evaluation -> CorrelationIdFilter.getCorrelationId().map(correlationId -> {
                    if (evaluation.result() instanceof Success success) {
                        JsonNode body = success.result().isArray()
                                ? success.result()
                                : objectMapper.createArrayNode();
                        boolean any = body.size() > 0;
                        metrics.recordDecision(QueryType.USER_TENANTS.tag(), any);
                        decisionLog.logDecision(QueryType.USER_TENANTS, summary, any, evaluation.cached(),
                                query, null, correlationId);
                        return body;
                    }
                    recordFallback(QueryType.USER_TENANTS, summary, (Failure) evaluation.result(), query, correlationId);
                    return (JsonNode) objectMapper.createArrayNode();
                }));
    }

    private Mono<Evaluation> evaluate(QueryType type, String key, Object input, CacheDirectives directives) {
        return lookup(type, key, directives)
                .map(cached -> new Evaluation(new Success(cached), true))
                .switchIfEmpty(Mono.defer(() -> callEngine(type, input)
                        .flatMap(result -> store(key, result, directives)
                                .thenReturn(new Evaluation(result, false)))));
    }

    private Mono<EngineResult> callEngine(QueryType type, Object input) {
        return engineClient.query(type.enginePath(), input)
                .doOnNext(result -> {
                    if (result instanceof Success) {
                        statistics.reportSuccess();
                    } else {
                        statistics.reportFailure();
                    }
                });
    }

    private Mono<JsonNode> lookup(QueryType type, String key, CacheDirectives directives) {
        if (!cachingEnabled() || !directives.read()) {
            return Mono.empty();
        }
        return cache.get(key)
                .doOnNext(hit -> metrics.recordCacheHit(type.tag()))
                .switchIfEmpty(Mono.fromRunnable(() -> metrics.recordCacheMiss(type.tag())))
                .onErrorResume(e -> {
                    log.warn("Decision cache lookup failed for key {}, treating as miss: {}",
                            key, StringSanitizer.forLog(e.getMessage()));
                    metrics.recordCacheMiss(type.tag());
                    return Mono.empty();
                });
    }

    private Mono<Void> store(String key, EngineResult result, CacheDirectives directives) {
        if (!cachingEnabled() || !directives.write()
                || !(result instanceof Success success) || success.result().isMissingNode()) {
            return Mono.empty();
        }
        return cache.put(key, success.result())
                .onErrorResume(e -> {
                    log.warn("Decision cache write failed for key {}: {}", key, StringSanitizer.forLog(e.getMessage()));
                    return Mono.empty();
                });
    }

    private Mono<List<Optional<JsonNode>>> lookupAll(List<String> keys, CacheDirectives directives) {
        return Flux.fromIterable(keys)
                .concatMap(key -> lookup(QueryType.BULK, key, directives)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty()))
                .collectList();
    }

    private Mono<BulkEvaluation> mergeBulk(
            EngineResult result,
            List<Optional<JsonNode>> cached,
            List<Integer> missed,
            List<String> keys,
            CacheDirectives directives) {

        List<Optional<JsonNode>> decisions = new ArrayList<>(cached);
        Set<Integer> fromCache = cachedIndexes(cached);
        if (result instanceof Failure failure) {
            return Mono.just(new BulkEvaluation(decisions, fromCache, failure));
        }

        JsonNode allow = ((Success) result).result().path("allow");
        if (!allow.isArray() || allow.size() != missed.size()) {
            Failure malformed = new Failure(EngineResult.Kind.MALFORMED_RESPONSE,
                    "Expected " + missed.size() + " bulk decisions, got " + (allow.isArray() ? allow.size() : 0));
            return Mono.just(new BulkEvaluation(decisions, fromCache, malformed));
        }

        List<Mono<Void>> writes = new ArrayList<>(missed.size());
        for (int i = 0; i < missed.size(); i++) {
            int index = missed.get(i);
            JsonNode decision = allow.get(i);
            decisions.set(index, Optional.of(decision));
            writes.add(store(keys.get(index), new Success(decision), directives));
        }
        return Mono.when(writes).thenReturn(new BulkEvaluation(decisions, fromCache, null));
    }

    private static Set<Integer> cachedIndexes(List<Optional<JsonNode>> cached) {
        Set<Integer> indexes = new HashSet<>();
        for (int i = 0; i < cached.size(); i++) {
            if (cached.get(i).isPresent()) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    private AuthorizationResult shapeAllowed(AuthorizationQuery query, JsonNode raw) {
        if (!raw.isObject()) {
            return AuthorizationResult.denied();
        }
        boolean allow = raw.path("allow").asBoolean(false);
        JsonNode processed = raw.path("authorization_query");

        ObjectNode shapedQuery = objectMapper.createObjectNode();
        shapedQuery.set("user", processed.has("user") ? processed.get("user") : objectMapper.valueToTree(query.user()));
        shapedQuery.set("action", processed.has("action") ? processed.get("action") : shapedQuery.textNode(query.action()));
        shapedQuery.set("resource", processed.has("resource")
                ? processed.get("resource")
                : objectMapper.valueToTree(query.resource()));

        ObjectNode debug = objectMapper.createObjectNode();
        debug.set("warnings", listOrEmpty(raw.get("debug")));
        debug.set("user_roles", listOrEmpty(raw.get("user_roles")));
        debug.set("granting_permission", listOrEmpty(raw.get("granting_permission")));
        debug.set("user_permissions", listOrEmpty(raw.get("user_permissions")));

        return new AuthorizationResult(allow, shapedQuery, debug, allow);
    }

    private AuthorizationResult shapeBulkEntry(JsonNode raw) {
        boolean allow = raw.path("allow").asBoolean(false);
        JsonNode query = raw.get("query");
        JsonNode debug = raw.get("debug");
        return new AuthorizationResult(allow, query, debug, allow);
    }

    private JsonNode listOrEmpty(JsonNode node) {
        if (node == null || node.isNull()) {
            return objectMapper.createArrayNode();
        }
        return node;
    }

    private void recordFallback(QueryType type, String summary, Failure failure, Object input, String correlationId) {
        metrics.recordFallback(type.tag(), failure.kind().tagValue());
        metrics.recordDecision(type.tag(), false);
        decisionLog.logFallback(type, summary, failure, input, correlationId);
    }

    private boolean cachingEnabled() {
        return !DecisionCacheProperties.STORE_NONE.equals(cache.store());
    }

    private record Evaluation(EngineResult result, boolean cached) {
    }

    /**
     * Per-check decisions in request order; {@code failure} is set when the engine call for the
     * missed checks failed.
     */
    private record BulkEvaluation(List<Optional<JsonNode>> decisions, Set<Integer> cachedIndexes, Failure failure) {
    }
}
