package com.example.pdp.datafilter.expression;

import com.example.pdp.datafilter.expression.Operand.BooleanExpression;
import com.example.pdp.datafilter.expression.Operand.Value;
import com.example.pdp.datafilter.expression.Operand.Variable;
import com.example.pdp.datafilter.rego.QuerySet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BooleanExpressionTranslator")
class BooleanExpressionTranslatorTest {

    private static final String TENANT_EQ_DEFAULT = """
            {"terms": [
              {"type": "ref", "value": [{"type": "var", "value": "eq"}]},
              {"type": "ref", "value": [{"type": "var", "value": "input"},
                                        {"type": "string", "value": "resource"},
                                        {"type": "string", "value": "tenant"}]},
              {"type": "string", "value": "default"}
            ]}
            """;

    private static final String KEY_NE_SECRET = """
            {"terms": [
              {"type": "ref", "value": [{"type": "var", "value": "neq"}]},
              {"type": "ref", "value": [{"type": "var", "value": "input"},
                                        {"type": "string", "value": "resource"},
                                        {"type": "string", "value": "key"}]},
              {"type": "string", "value": "secret"}
            ]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BooleanExpressionTranslator translator = new BooleanExpressionTranslator();

    private QuerySet querySet(String json) throws Exception {
        return QuerySet.parse(objectMapper.readTree(json));
    }

    @Nested
    @DisplayName("trivial query sets")
    class TrivialQuerySets {

        @Test
        @DisplayName("should deny when there are no queries")
        void shouldDenyWithoutQueries() throws Exception {
            ResidualPolicy policy = translator.translate(querySet("{\"queries\": []}"));

            assertThat(policy.type()).isEqualTo(ResidualPolicyType.ALWAYS_DENY);
            assertThat(policy.condition()).isNull();
        }

        @Test
        @DisplayName("should allow when any query is empty")
        void shouldAllowWhenAnyQueryEmpty() throws Exception {
            ResidualPolicy policy = translator.translate(querySet(
                    "{\"queries\": [[" + TENANT_EQ_DEFAULT + "], []]}"));

            assertThat(policy.type()).isEqualTo(ResidualPolicyType.ALWAYS_ALLOW);
            assertThat(policy.condition()).isNull();
        }
    }

    @Nested
    @DisplayName("conditional query sets")
    class ConditionalQuerySets {

        @Test
        @DisplayName("should not wrap a single query in 'or'")
        void shouldNotWrapSingleQuery() throws Exception {
            ResidualPolicy policy = translator.translate(querySet(
                    "{\"queries\": [[" + TENANT_EQ_DEFAULT + "]]}"));

            assertThat(policy.type()).isEqualTo(ResidualPolicyType.CONDITIONAL);
            assertThat(policy.condition()).isEqualTo(new BooleanExpression("eq", List.of(
                    new Variable("input.resource.tenant"),
                    new Value("default"))));
        }

        @Test
        @DisplayName("should combine queries with 'or' and expressions with 'and'")
        void shouldCombineQueries() throws Exception {
            ResidualPolicy policy = translator.translate(querySet(
                    "{\"queries\": [[" + TENANT_EQ_DEFAULT + ", " + KEY_NE_SECRET + "], [" + KEY_NE_SECRET + "]]}"));

            BooleanExpression condition = policy.condition();
            assertThat(condition.operator()).isEqualTo(BooleanExpression.OR);
            assertThat(condition.operands()).hasSize(2);

            BooleanExpression first = (BooleanExpression) condition.operands().get(0);
            assertThat(first.operator()).isEqualTo(BooleanExpression.AND);
            assertThat(first.operands()).hasSize(2);

            BooleanExpression second = (BooleanExpression) condition.operands().get(1);
            assertThat(second.operator()).isEqualTo("neq");
        }

        @Test
        @DisplayName("should wrap a bare function call in a 'call' expression")
        void shouldWrapCall() throws Exception {
            ResidualPolicy policy = translator.translate(querySet("""
                    {"queries": [[{"terms": {"type": "call", "value": [
                      {"type": "ref", "value": [{"type": "var", "value": "startswith"}]},
                      {"type": "ref", "value": [{"type": "var", "value": "input"},
                                                {"type": "string", "value": "resource"},
                                                {"type": "string", "value": "key"}]},
                      {"type": "string", "value": "doc-"}
                    ]}}]]}
                    """));

            BooleanExpression condition = policy.condition();
            assertThat(condition.operator()).isEqualTo(BooleanExpression.CALL);
            BooleanExpression call = (BooleanExpression) condition.operands().get(0);
            assertThat(call.operator()).isEqualTo("startswith");
            assertThat(call.operands()).containsExactly(
                    new Variable("input.resource.key"), new Value("doc-"));
        }
    }

    @Nested
    @DisplayName("JSON form")
    class JsonForm {

        @Test
        @DisplayName("should serialize a conditional policy as nested expression objects")
        void shouldSerializeConditional() throws Exception {
            ResidualPolicy policy = translator.translate(querySet(
                    "{\"queries\": [[" + TENANT_EQ_DEFAULT + "]]}"));

            JsonNode json = objectMapper.valueToTree(policy);

            assertThat(json.path("type").asText()).isEqualTo("conditional");
            JsonNode expression = json.path("condition").path("expression");
            assertThat(expression.path("operator").asText()).isEqualTo("eq");
            assertThat(expression.path("operands").get(0).path("variable").asText())
                    .isEqualTo("input.resource.tenant");
            assertThat(expression.path("operands").get(1).path("value").asText()).isEqualTo("default");
        }

        @Test
        @DisplayName("should omit the condition of an unconditional policy")
        void shouldOmitCondition() {
            JsonNode json = objectMapper.valueToTree(ResidualPolicy.alwaysAllow());

            assertThat(json.path("type").asText()).isEqualTo("always_allow");
            assertThat(json.has("condition")).isFalse();
        }
    }
}
