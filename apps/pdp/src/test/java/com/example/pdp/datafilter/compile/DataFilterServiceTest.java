package com.example.pdp.datafilter.compile;

import com.example.pdp.config.properties.PolicyEngineProperties;
import com.example.pdp.datafilter.expression.BooleanExpressionTranslator;
import com.example.pdp.datafilter.expression.ResidualPolicyType;
import com.example.pdp.datafilter.rego.RegoParseException;
import com.example.pdp.engine.EngineResult;
import com.example.pdp.engine.PolicyEngineClient;
import com.example.pdp.enforcer.model.User;
import com.example.pdp.exception.PolicyEngineUnavailableException;
import com.example.pdp.observability.metrics.DecisionMetrics;
import com.example.pdp.util.PolicyEngineStub;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DataFilterService")
class DataFilterServiceTest {

    private static final String COMPILE_PATH = "/v1/compile";

    private PolicyEngineStub engine;
    private DataFilterService service;

    @BeforeEach
    void setUp() {
        engine = new PolicyEngineStub();
        ObjectMapper objectMapper = new ObjectMapper();
        PolicyEngineClient client = new PolicyEngineClient(engine.webClient(), PolicyEngineProperties.defaults(),
                objectMapper, new DecisionMetrics(new SimpleMeterRegistry()));
        service = new DataFilterService(new PolicyCompileClient(client), new BooleanExpressionTranslator());
    }

    private static FilterResourcesRequest request() {
        return new FilterResourcesRequest(User.of("user1"), "read",
                new FilterResourcesRequest.ResourceType("document"), Map.of());
    }

    @Nested
    @DisplayName("successful compilation")
    class SuccessfulCompilation {

        @Test
        @DisplayName("should return a conditional policy for a residual query")
        void shouldReturnConditional() {
            engine.respond(COMPILE_PATH, """
                    {"result": {"queries": [[{"index": 0, "terms": [
                      {"type": "ref", "value": [{"type": "var", "value": "eq"}]},
                      {"type": "ref", "value": [{"type": "var", "value": "input"},
                                                {"type": "string", "value": "resource"},
                                                {"type": "string", "value": "tenant"}]},
                      {"type": "string", "value": "default"}
                    ]}]]}}
                    """);

            StepVerifier.create(service.filterResources(request()))
                    .assertNext(policy -> {
                        assertThat(policy.type()).isEqualTo(ResidualPolicyType.CONDITIONAL);
                        assertThat(policy.condition().operator()).isEqualTo("eq");
                    })
                    .verifyComplete();

            assertThat(engine.callsTo(COMPILE_PATH)).isEqualTo(1);
        }

        @Test
        @DisplayName("should deny everything when the engine returns no queries")
        void shouldDenyWithoutQueries() {
            engine.respond(COMPILE_PATH, "{\"result\": {}}");

            StepVerifier.create(service.filterResources(request()))
                    .assertNext(policy -> assertThat(policy.type()).isEqualTo(ResidualPolicyType.ALWAYS_DENY))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should signal engine unavailability on a non-2xx status")
        void shouldSignalUnavailableOnBadStatus() {
            engine.respond(COMPILE_PATH, HttpStatus.INTERNAL_SERVER_ERROR, "{\"code\": \"internal_error\"}");

            StepVerifier.create(service.filterResources(request()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(PolicyEngineUnavailableException.class);
                        assertThat(((PolicyEngineUnavailableException) error).getKind())
                                .isEqualTo(EngineResult.Kind.BAD_STATUS);
                    })
                    .verify();
        }

        @Test
        @DisplayName("should signal engine unavailability when the connection fails")
        void shouldSignalUnavailableOnConnectionFailure() {
            engine.refuse(COMPILE_PATH);

            StepVerifier.create(service.filterResources(request()))
                    .expectError(PolicyEngineUnavailableException.class)
                    .verify();
        }

        @Test
        @DisplayName("should signal a parse error for a malformed query set")
        void shouldSignalParseError() {
            engine.respond(COMPILE_PATH, "{\"result\": {\"queries\": [[{\"terms\": [{\"type\": \"tuple\"}]}]]}}");

            StepVerifier.create(service.filterResources(request()))
                    .expectError(RegoParseException.class)
                    .verify();
        }

        @Test
        @DisplayName("should signal a parse error when the compile body is not JSON")
        void shouldSignalParseErrorForUnreadableBody() {
            engine.respond(COMPILE_PATH, "<html>gateway</html>");

            StepVerifier.create(service.filterResources(request()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(RegoParseException.class);
                        assertThat(((RegoParseException) error).getCode()).isEqualTo("PARSE_ERROR");
                    })
                    .verify();

            assertThat(engine.callsTo(COMPILE_PATH)).isEqualTo(1);
        }
    }
}
