package com.example.pdp.enforcer.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.pdp.config.properties.DecisionCacheProperties;
import com.example.pdp.config.properties.DecisionLogProperties;
import com.example.pdp.config.properties.PolicyEngineProperties;
import com.example.pdp.engine.PolicyEngineClient;
import com.example.pdp.enforcer.cache.DecisionCache;
import com.example.pdp.enforcer.cache.InMemoryDecisionCache;
import com.example.pdp.enforcer.cache.NoOpDecisionCache;
import com.example.pdp.enforcer.log.DecisionLogService;
import com.example.pdp.enforcer.mapping.MappingRule;
import com.example.pdp.enforcer.mapping.MappingRuleMatcher;
import com.example.pdp.enforcer.mapping.StaticMappingRuleCatalog;
import com.example.pdp.enforcer.model.AuthorizationQuery;
import com.example.pdp.enforcer.model.BulkAuthorizationQuery;
import com.example.pdp.enforcer.model.CacheDirectives;
import com.example.pdp.enforcer.model.UrlAuthorizationQuery;
import com.example.pdp.enforcer.model.User;
import com.example.pdp.enforcer.model.UserPermissionsQuery;
import com.example.pdp.enforcer.model.UserTenantsQuery;
import com.example.pdp.enforcer.statistics.DecisionStatisticsTracker;
import com.example.pdp.observability.metrics.DecisionMetrics;
import com.example.pdp.util.PolicyEngineStub;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.example.pdp.util.AuthorizationQueryTestBuilder.aQuery;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthorizationRouter")
class AuthorizationRouterTest {

    private static final String ROOT = "/v1/data/permit/root";
    private static final String BULK = "/v1/data/permit/bulk";
    private static final String ANY_TENANT = "/v1/data/permit/any_tenant";
    private static final String USER_PERMISSIONS = "/v1/data/permit/user_permissions";
    private static final String USER_TENANTS = "/v1/data/permit/user_permissions/tenants";

    private static final String ALLOW = """
            {"result": {"allow": true,
                        "debug": [],
                        "user_roles": [{"id": "viewer"}],
                        "granting_permission": [{"permission": {"key": "document:read"}}],
                        "user_permissions": []}}
            """;

    private static final String DENY = "{\"result\": {\"allow\": false}}";

    @Mock
    private DecisionStatisticsTracker statistics;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private PolicyEngineStub engine;
    private DecisionMetrics metrics;

    @BeforeEach
    void setUp() {
        engine = new PolicyEngineStub();
        metrics = new DecisionMetrics(new SimpleMeterRegistry());
    }

    private AuthorizationRouter router(DecisionCache cache, MappingRule... rules) {
        PolicyEngineProperties properties = new PolicyEngineProperties(
                "http://localhost:8181", Duration.ofMillis(200), null, null);
        PolicyEngineClient client = new PolicyEngineClient(engine.webClient(), properties, objectMapper, metrics);
        return new AuthorizationRouter(
                client,
                cache,
                statistics,
                new DecisionLogService(objectMapper, new DecisionLogProperties(true)),
                metrics,
                new StaticMappingRuleCatalog(List.of(rules)),
                new MappingRuleMatcher(),
                objectMapper);
    }

    private AuthorizationRouter uncachedRouter(MappingRule... rules) {
        return router(new NoOpDecisionCache(), rules);
    }

    private AuthorizationRouter cachedRouter() {
        return router(new InMemoryDecisionCache(new DecisionCacheProperties(true, "memory", null, null)));
    }

    @Nested
    @DisplayName("isAllowed")
    class IsAllowed {

        @Test
        @DisplayName("should shape an allow decision with query and debug")
        void shouldShapeAllow() {
            engine.respond(ROOT, ALLOW);

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).isTrue();
                        assertThat(result.result()).isTrue();
                        assertThat(result.query().path("user").path("key").asText()).isEqualTo("user1");
                        assertThat(result.query().path("action").asText()).isEqualTo("read");
                        assertThat(result.query().path("resource").path("type").asText()).isEqualTo("document");
                        assertThat(result.debug().path("warnings").isArray()).isTrue();
                        assertThat(result.debug().path("user_roles").get(0).path("id").asText()).isEqualTo("viewer");
                        assertThat(result.debug().path("granting_permission")).hasSize(1);
                    })
                    .verifyComplete();

            verify(statistics).reportSuccess();
            assertThat(metrics.count("pdp.decision", "type", "allowed", "result", "allow")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should echo the query the engine processed")
        void shouldEchoProcessedQuery() {
            engine.respond(ROOT, """
                    {"result": {"allow": false,
                                "authorization_query": {"user": {"key": "user1", "attributes": {"team": "a"}}}}}
                    """);

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).isFalse();
                        assertThat(result.query().path("user").path("attributes").path("team").asText()).isEqualTo("a");
                        assertThat(result.query().path("action").asText()).isEqualTo("read");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the queried document is undefined")
        void shouldDenyOnUndefinedResult() {
            engine.respond(ROOT, "{}");

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).isFalse())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("engine failures")
    class EngineFailures {

        @Test
        @DisplayName("should fall back to deny when the engine refuses connections")
        void shouldFallBackOnConnectionFailure() {
            engine.refuse(ROOT);

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).isFalse();
                        assertThat(result.result()).isFalse();
                        assertThat(result.query()).isNull();
                    })
                    .verifyComplete();

            verify(statistics).reportFailure();
            verify(statistics, never()).reportSuccess();
            assertThat(metrics.count("pdp.engine.failure", "type", "allowed", "kind", "connection")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fall back to deny when the engine times out")
        void shouldFallBackOnTimeout() {
            engine.hang(ROOT);

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).isFalse())
                    .verifyComplete();

            assertThat(metrics.count("pdp.engine.failure", "type", "allowed", "kind", "timeout")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fall back to deny on a non-2xx status")
        void shouldFallBackOnBadStatus() {
            engine.respond(ROOT, HttpStatus.INTERNAL_SERVER_ERROR, "{}");

            StepVerifier.create(uncachedRouter().isAllowed(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).isFalse())
                    .verifyComplete();

            assertThat(metrics.count("pdp.engine.failure", "type", "allowed", "kind", "bad_status")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should answer every bulk check with a fallback")
        void shouldFallBackForBulk() {
            engine.refuse(BULK);
            BulkAuthorizationQuery query = new BulkAuthorizationQuery(List.of(
                    aQuery().build(), aQuery().withAction("write").build()));

            StepVerifier.create(uncachedRouter().isAllowedBulk(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).hasSize(2);
                        assertThat(result.allow()).allSatisfy(check -> {
                            assertThat(check.allow()).isFalse();
                            assertThat(check.debug().path("error").asText()).isEqualTo("policy engine unavailable");
                        });
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny every bulk check when the engine returns too few decisions")
        void shouldFallBackForShortBulkReply() {
            engine.respond(BULK, "{\"result\": {\"allow\": [{\"allow\": true}]}}");
            BulkAuthorizationQuery query = new BulkAuthorizationQuery(List.of(
                    aQuery().build(), aQuery().withAction("write").build()));

            StepVerifier.create(uncachedRouter().isAllowedBulk(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).hasSize(2);
                        assertThat(result.allow()).allSatisfy(check -> {
                            assertThat(check.allow()).isFalse();
                            assertThat(check.debug().path("error").asText()).isEqualTo("policy engine unavailable");
                        });
                    })
                    .verifyComplete();

            assertThat(metrics.count("pdp.engine.failure", "type", "allowed_bulk", "kind", "malformed_response"))
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("should deny every bulk check when 'allow' is not an array")
        void shouldFallBackForNonArrayBulkReply() {
            engine.respond(BULK, "{\"result\": {\"allow\": true}}");
            BulkAuthorizationQuery query = new BulkAuthorizationQuery(List.of(
                    aQuery().build(), aQuery().withAction("write").build()));

            StepVerifier.create(uncachedRouter().isAllowedBulk(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).hasSize(2);
                        assertThat(result.allow()).allSatisfy(check -> {
                            assertThat(check.allow()).isFalse();
                            assertThat(check.debug().path("error").asText()).isEqualTo("policy engine unavailable");
                        });
                    })
                    .verifyComplete();

            assertThat(metrics.count("pdp.engine.failure", "type", "allowed_bulk", "kind", "malformed_response"))
                    .isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("decision cache")
    class DecisionCaching {

        @Test
        @DisplayName("should answer an identical query from the cache")
        void shouldHitCache() {
            engine.respond(ROOT, ALLOW);
            AuthorizationRouter router = cachedRouter();
            AuthorizationQuery query = aQuery().build();

            StepVerifier.create(router.isAllowed(query, CacheDirectives.DEFAULT).then(router.isAllowed(query, CacheDirectives.DEFAULT)))
                    .assertNext(result -> assertThat(result.allow()).isTrue())
                    .verifyComplete();

            assertThat(engine.callsTo(ROOT)).isEqualTo(1);
            assertThat(metrics.count("pdp.cache", "type", "allowed", "result", "hit")).isEqualTo(1.0);
            assertThat(metrics.count("pdp.cache", "type", "allowed", "result", "miss")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should not share entries between users")
        void shouldNotShareBetweenUsers() {
            engine.respond(ROOT, ALLOW);
            AuthorizationRouter router = cachedRouter();

            StepVerifier.create(router.isAllowed(aQuery().withUser("alice").build(), CacheDirectives.DEFAULT)
                            .then(router.isAllowed(aQuery().withUser("bob").build(), CacheDirectives.DEFAULT)))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(engine.callsTo(ROOT)).isEqualTo(2);
        }

        @Test
        @DisplayName("should bypass the lookup for no-cache")
        void shouldBypassLookupForNoCache() {
            engine.respond(ROOT, ALLOW);
            AuthorizationRouter router = cachedRouter();
            AuthorizationQuery query = aQuery().build();
            CacheDirectives noCache = CacheDirectives.fromHeader("no-cache");

            StepVerifier.create(router.isAllowed(query, CacheDirectives.DEFAULT).then(router.isAllowed(query, noCache)))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(engine.callsTo(ROOT)).isEqualTo(2);
        }

        @Test
        @DisplayName("should not store the result for no-store")
        void shouldNotStoreForNoStore() {
            engine.respond(ROOT, ALLOW);
            AuthorizationRouter router = cachedRouter();
            AuthorizationQuery query = aQuery().build();
            CacheDirectives noStore = CacheDirectives.fromHeader("no-store");

            StepVerifier.create(router.isAllowed(query, noStore).then(router.isAllowed(query, CacheDirectives.DEFAULT)))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(engine.callsTo(ROOT)).isEqualTo(2);
        }

        @Test
        @DisplayName("should not cache fallbacks")
        void shouldNotCacheFallbacks() {
            engine.refuse(ROOT);
            AuthorizationRouter router = cachedRouter();
            AuthorizationQuery query = aQuery().build();

            StepVerifier.create(router.isAllowed(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).isFalse())
                    .verifyComplete();

            engine.respond(ROOT, ALLOW);

            StepVerifier.create(router.isAllowed(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).isTrue())
                    .verifyComplete();
            verify(statistics, times(1)).reportFailure();
        }

        @Test
        @DisplayName("should send only uncached bulk checks to the engine")
        void shouldSendOnlyMissedBulkChecks() {
            engine.respond(BULK, "{\"result\": {\"allow\": [{\"allow\": true, \"result\": true}]}}");
            AuthorizationRouter router = cachedRouter();
            AuthorizationQuery read = aQuery().build();
            AuthorizationQuery write = aQuery().withAction("write").build();

            StepVerifier.create(router.isAllowedBulk(new BulkAuthorizationQuery(List.of(read)), CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allow()).singleElement()
                            .satisfies(check -> assertThat(check.allow()).isTrue()))
                    .verifyComplete();

            engine.respond(BULK, "{\"result\": {\"allow\": [{\"allow\": false, \"result\": false}]}}");

            StepVerifier.create(router.isAllowedBulk(new BulkAuthorizationQuery(List.of(read, write)), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).hasSize(2);
                        assertThat(result.allow().get(0).allow()).isTrue();
                        assertThat(result.allow().get(1).allow()).isFalse();
                    })
                    .verifyComplete();

            assertThat(engine.callsTo(BULK)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("other query shapes")
    class OtherQueryShapes {

        @Test
        @DisplayName("should return the tenants the check is allowed in")
        void shouldReturnAllowedTenants() {
            engine.respond(ANY_TENANT, """
                    {"result": {"allowed_tenants": [
                      {"tenant": {"key": "default", "attributes": {}}, "allow": true, "result": true}
                    ]}}
                    """);

            StepVerifier.create(uncachedRouter().isAllowedAllTenants(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allowedTenants()).hasSize(1);
                        assertThat(result.allowedTenants().get(0).path("tenant").path("key").asText()).isEqualTo("default");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return no tenants when the engine fails")
        void shouldReturnNoTenantsOnFailure() {
            engine.refuse(ANY_TENANT);

            StepVerifier.create(uncachedRouter().isAllowedAllTenants(aQuery().build(), CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.allowedTenants()).isEmpty())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should unwrap user permissions")
        void shouldUnwrapPermissions() {
            engine.respond(USER_PERMISSIONS, """
                    {"result": {"permissions": {"document:doc-1": {"permissions": ["document:read"]}}}}
                    """);
            UserPermissionsQuery query = new UserPermissionsQuery(User.of("user1"), null, null,
                    List.of("document"), Map.of());

            StepVerifier.create(uncachedRouter().userPermissions(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> assertThat(result.path("document:doc-1").path("permissions").get(0).asText())
                            .isEqualTo("document:read"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return empty permissions when the engine fails")
        void shouldReturnEmptyPermissionsOnFailure() {
            engine.refuse(USER_PERMISSIONS);
            UserPermissionsQuery query = new UserPermissionsQuery(User.of("user1"), null, null, null, null);

            StepVerifier.create(uncachedRouter().userPermissions(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.isObject()).isTrue();
                        assertThat(result.size()).isZero();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return the user's tenants")
        void shouldReturnUserTenants() {
            engine.respond(USER_TENANTS, "{\"result\": [{\"key\": \"tenant-1\", \"attributes\": {}}]}");

            StepVerifier.create(uncachedRouter().userTenants(new UserTenantsQuery(User.of("user1"), null), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.isArray()).isTrue();
                        assertThat(result.get(0).path("key").asText()).isEqualTo("tenant-1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return no user tenants when the engine fails")
        void shouldReturnNoUserTenantsOnFailure() {
            engine.refuse(USER_TENANTS);

            StepVerifier.create(uncachedRouter().userTenants(new UserTenantsQuery(User.of("user1"), null), CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.isArray()).isTrue();
                        assertThat(result.size()).isZero();
                    })
                    .verifyComplete();

            verify(statistics).reportFailure();
            assertThat(metrics.count("pdp.engine.failure", "type", "user_tenants", "kind", "connection")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("isAllowedUrl")
    class IsAllowedUrl {

        private Logger decisionLogger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attachAppender() {
            decisionLogger = (Logger) LoggerFactory.getLogger(DecisionLogService.LOGGER_NAME);
            appender = new ListAppender<>();
            appender.start();
            decisionLogger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            decisionLogger.detachAppender(appender);
        }

        @Test
        @DisplayName("should check the resource and action of the matching rule")
        void shouldCheckMappedResource() {
            engine.respond(ROOT, "{\"result\": {\"allow\": true}}");
            AuthorizationRouter router = uncachedRouter(
                    MappingRule.template("/files/{id}", "delete", "file", null, null));
            UrlAuthorizationQuery query = new UrlAuthorizationQuery(User.of("user1"), "DELETE",
                    "https://files.example.com/files/7", "default", null, null);

            StepVerifier.create(router.isAllowedUrl(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).isTrue();
                        assertThat(result.query().path("action").asText()).isEqualTo("delete");
                        assertThat(result.query().path("resource").path("type").asText()).isEqualTo("file");
                        assertThat(result.query().path("resource").path("tenant").asText()).isEqualTo("default");
                        assertThat(result.query().path("resource").path("attributes").path("id").asText()).isEqualTo("7");
                    })
                    .verifyComplete();

            assertThat(metrics.count("pdp.decision", "type", "allowed_url", "result", "allow")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should deny without an engine call when no rule matches")
        void shouldDenyWithoutRule() throws Exception {
            UrlAuthorizationQuery query = new UrlAuthorizationQuery(User.of("user1"), "GET",
                    "/unknown", "default", null, null);

            StepVerifier.create(uncachedRouter().isAllowedUrl(query, CacheDirectives.DEFAULT))
                    .assertNext(result -> {
                        assertThat(result.allow()).isFalse();
                        assertThat(result.debug().path("reason").asText()).isEqualTo("Matching mapping rule not found");
                    })
                    .verifyComplete();

            assertThat(engine.requests()).isEmpty();

            assertThat(appender.list).hasSize(1);
            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            JsonNode line = objectMapper.readTree(event.getFormattedMessage());
            assertThat(line.path("queryType").asText()).isEqualTo("allowed_url");
            assertThat(line.path("outcome").asText()).isEqualTo("DENY");
            assertThat(line.path("message").asText()).isEqualTo("is allowed = false | (user1, GET /unknown)");
            assertThat(line.path("debug").path("reason").asText()).isEqualTo("Matching mapping rule not found");
        }
    }
}
