package io.github.cyfko.wilkinson.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON rendering of formula metadata, token streams and errors.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("FormulaJson Tests")
class FormulaJsonTest {

    private final FormulaJson json = new FormulaJson();

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("Should render top-level fields in snake_case")
        void testTopLevelFields() {
            ObjectNode node = json.parseFormula("y ~ x + (1 | g)");

            assertEquals("y ~ x + (1 | g)", node.get("formula").asText());
            assertTrue(node.get("has_intercept").asBoolean());
            assertEquals("gaussian", node.get("family").asText());
            assertTrue(node.get("is_random_effects_model").asBoolean());
            assertFalse(node.get("has_uncorrelated_slopes_and_intercepts").asBoolean());
            assertEquals(1, node.get("response_variable_count").asInt());
            assertEquals(List.of("y", "x", "g"), texts(node.get("column_names")));
            assertEquals(List.of("y", "intercept", "x", "g"), texts(node.get("all_generated_columns")));
            assertTrue(node.get("auxiliary_parameters").isArray());
        }

        @Test
        @DisplayName("Should key the formula order by 1-based position")
        void testFormulaOrderKeys() {
            JsonNode order = json.parseFormula("mpg ~ wt*hp").get("all_generated_columns_formula_order");

            List<String> keys = new ArrayList<>();
            Iterator<String> names = order.fieldNames();
            names.forEachRemaining(keys::add);
            assertEquals(List.of("1", "2", "3", "4", "5"), keys);
            assertEquals("wt_hp", order.get("5").asText());
        }

        @Test
        @DisplayName("Should render variables with roles, transformations and random effects")
        void testVariables() {
            JsonNode variables = json.parseFormula("y ~ poly(x, 2) + (1 + z || g)").get("variables");

            JsonNode x = variables.get(1);
            assertEquals(2, x.get("id").asInt());
            assertEquals("x", x.get("name").asText());
            assertEquals("FixedEffect", x.get("role").asText());
            assertEquals(List.of("x_poly_1", "x_poly_2"), texts(x.get("generated_columns")));
            JsonNode poly = x.get("transformations").get(0);
            assertEquals("poly", poly.get("function").asText());
            assertEquals(2, poly.get("parameters").get("degree").asInt());
            assertTrue(poly.get("parameters").get("orthogonal").asBoolean());

            JsonNode g = variables.get(3);
            assertEquals("GroupingVariable", g.get("role").asText());
            JsonNode grouping = g.get("random_effects").get(0);
            assertEquals("grouping", grouping.get("kind").asText());
            assertEquals("Uncorrelated", grouping.get("correlation").asText());
            assertFalse(grouping.get("correlated").asBoolean());
            assertEquals(List.of("z"), texts(grouping.get("variables")));
            assertFalse(grouping.has("correlation_id"));
        }

        @Test
        void testAuxiliaryParameters() {
            JsonNode sigma = json.parseFormula("y ~ x, sigma ~ z").get("auxiliary_parameters").get(0);

            assertEquals("sigma", sigma.get("parameter").asText());
            assertTrue(sigma.get("has_intercept").asBoolean());
            assertEquals(List.of("z"), texts(sigma.get("column_names")));
            assertEquals(List.of("intercept", "z"), texts(sigma.get("generated_columns")));
        }
    }

    @Test
    @DisplayName("Should render tokens with their kind labels, Unknown included")
    void testTokens() {
        ArrayNode tokens = json.lexFormula("y ~ x * z ?");

        assertEquals(6, tokens.size());
        assertEquals("ColumnName", tokens.get(0).get("token").asText());
        assertEquals("Tilde", tokens.get(1).get("token").asText());
        assertEquals("InteractionAndEffect", tokens.get(3).get("token").asText());
        assertEquals("Unknown", tokens.get(5).get("token").asText());
        assertEquals("?", tokens.get(5).get("lexeme").asText());
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should describe syntax errors with position and expectations")
        void testSyntaxError() {
            FormulaSyntaxException error = assertThrows(FormulaSyntaxException.class,
                () -> json.parseFormula("y ~ x +"));

            ObjectNode node = json.describeError(error);

            assertEquals("syntax", node.get("error").asText());
            assertEquals(7, node.get("position").asInt());
            assertEquals("EndOfInput", node.get("found").get("token").asText());
            assertTrue(texts(node.get("expected")).contains("ColumnName"));
            assertEquals(List.of("y", "~", "x", "+"), texts(node.get("consumed")));
        }

        @Test
        @DisplayName("Should describe build errors with the offending variable")
        void testBuildError() {
            FormulaBuildException error = assertThrows(FormulaBuildException.class,
                () -> json.parseFormula("y ~ (g | g)"));

            ObjectNode node = json.describeError(error);

            assertEquals("build", node.get("error").asText());
            assertEquals("g", node.get("variable").asText());
            assertEquals("y ~ (g | g)", node.get("formula").asText());
        }
    }

    @Test
    void testPrettyJson() {
        String text = json.toPrettyJson(json.parseFormula("y ~ x"));

        assertTrue(text.contains("\"all_generated_columns\""));
        assertTrue(text.contains(System.lineSeparator()) || text.contains("\n"));
    }
}
