package io.github.cyfko.wilkinson.core.semantic;

import io.github.cyfko.wilkinson.core.ast.CorrelationKind;
import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.lexer.Lexer;
import io.github.cyfko.wilkinson.core.model.AuxiliaryParameter;
import io.github.cyfko.wilkinson.core.model.Family;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;
import io.github.cyfko.wilkinson.core.model.Transformation;
import io.github.cyfko.wilkinson.core.model.Variable;
import io.github.cyfko.wilkinson.core.model.VariableRole;
import io.github.cyfko.wilkinson.core.parsing.FormulaGrammar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the semantic pass: variable registration, column naming and ordering,
 * random-effect structure, family and auxiliary parameters.
 */
class MetadataBuilderTest {

    private final MetadataBuilder builder = new MetadataBuilder();

    private FormulaMetaData build(String formula) {
        return build(formula, FormulaPolicy.defaults());
    }

    private FormulaMetaData build(String formula, FormulaPolicy policy) {
        return builder.build(FormulaGrammar.parse(formula, Lexer.lex(formula), policy), formula, policy);
    }

    private Variable variable(FormulaMetaData meta, String name) {
        return meta.variable(name).orElseThrow(() -> new AssertionError("no variable " + name));
    }

    private static List<String> formulaOrder(FormulaMetaData meta) {
        return new ArrayList<>(meta.allGeneratedColumnsFormulaOrder().values());
    }

    @Nested
    @DisplayName("Variables and ids")
    class Variables {

        @Test
        @DisplayName("y ~ x + z")
        void simpleFormula() {
            FormulaMetaData meta = build("y ~ x + z");

            assertTrue(meta.hasIntercept());
            assertEquals(Family.GAUSSIAN, meta.family());
            assertEquals(1, meta.responseVariableCount());
            assertEquals(List.of("y", "x", "z"), meta.columnNames());
            assertEquals(List.of("y", "intercept", "x", "z"), meta.allGeneratedColumns());
            assertEquals(Map.of(1, "y", 2, "intercept", 3, "x", 4, "z"), meta.allGeneratedColumnsFormulaOrder());
            assertFalse(meta.isRandomEffectsModel());

            Variable y = variable(meta, "y");
            assertEquals(1, y.id());
            assertEquals(VariableRole.RESPONSE, y.role());
            assertEquals(List.of("y"), y.generatedColumns());

            Variable x = variable(meta, "x");
            assertEquals(2, x.id());
            assertEquals(VariableRole.IDENTITY, x.role());
            assertEquals(3, variable(meta, "z").id());
        }

        @Test
        void explicitInterceptOnly() {
            FormulaMetaData meta = build("y ~ 1");
            assertTrue(meta.hasIntercept());
            assertEquals(List.of("y", "intercept"), meta.allGeneratedColumns());
            assertEquals(1, meta.variables().size());
        }

        @Test
        void noIntercept() {
            FormulaMetaData meta = build("y ~ 0");
            assertFalse(meta.hasIntercept());
            assertEquals(List.of("y"), meta.allGeneratedColumns());

            assertEquals(List.of("y", "x"), build("y ~ x - 1").allGeneratedColumns());
        }

        @Test
        @DisplayName("The intercept sits after the responses in id order and where it was written in formula order")
        void interceptPlacement() {
            FormulaMetaData meta = build("y ~ x + 1");

            assertEquals(List.of("y", "intercept", "x"), meta.allGeneratedColumns());
            assertEquals(List.of("y", "x", "intercept"), formulaOrder(meta));
        }

        @Test
        void multivariateResponse() {
            FormulaMetaData meta = build("mvbind(y1, y2) ~ x");

            assertEquals(2, meta.responseVariableCount());
            assertEquals(List.of("y1", "y2"), meta.responses().stream().map(Variable::name).toList());
            assertEquals(List.of("y1", "y2", "intercept", "x"), meta.allGeneratedColumns());
            assertEquals(3, variable(meta, "x").id());
        }

        @Test
        void oneSidedFormula() {
            FormulaMetaData meta = build("~ x");

            assertEquals(0, meta.responseVariableCount());
            assertTrue(meta.responses().isEmpty());
            assertEquals(List.of("intercept", "x"), meta.allGeneratedColumns());
        }

        @Test
        @DisplayName("Removed terms register nothing")
        void droppedTerms() {
            FormulaMetaData meta = build("y ~ x + z - z");

            assertTrue(meta.variable("z").isEmpty());
            assertEquals(List.of("y", "intercept", "x"), meta.allGeneratedColumns());
        }

        @Test
        @DisplayName("A variable keeps its first role and accumulates the others")
        void multipleRoles() {
            Variable x = variable(build("y ~ x + (x | g)"), "x");

            assertEquals(VariableRole.IDENTITY, x.role());
            assertEquals(List.of(VariableRole.IDENTITY, VariableRole.RANDOM_EFFECT), x.roles());
            assertTrue(x.hasRole(VariableRole.RANDOM_EFFECT));
            assertEquals(List.of("x"), x.generatedColumns());
        }
    }

    @Nested
    @DisplayName("Interactions")
    class Interactions {

        @Test
        @DisplayName("wt*hp generates main effects and the product, owned by the first operand")
        void fullInteraction() {
            FormulaMetaData meta = build("mpg ~ wt*hp");

            assertEquals(List.of("mpg", "intercept", "wt", "wt_hp", "hp"), meta.allGeneratedColumns());
            assertEquals(List.of("mpg", "intercept", "wt", "hp", "wt_hp"), formulaOrder(meta));

            Variable wt = variable(meta, "wt");
            assertEquals(VariableRole.FIXED_EFFECT, wt.role());
            assertEquals(List.of("wt", "wt_hp"), wt.generatedColumns());
            assertEquals(List.of("wt:hp"), wt.interactions());
            assertEquals(List.of("wt:hp"), variable(meta, "hp").interactions());
        }

        @Test
        @DisplayName("a*b*c expands to seven columns, a:b:c to one")
        void threeWay() {
            FormulaMetaData full = build("y ~ a*b*c");
            assertEquals(List.of("y", "intercept", "a", "b", "c", "a_b", "a_c", "b_c", "a_b_c"), formulaOrder(full));
            assertEquals(List.of("a:b", "a:c", "a:b:c"), variable(full, "a").interactions());

            FormulaMetaData only = build("y ~ a:b:c");
            assertEquals(List.of("y", "intercept", "a_b_c"), formulaOrder(only));
            assertEquals(List.of("a_b_c"), variable(only, "a").generatedColumns());
            assertTrue(variable(only, "b").generatedColumns().isEmpty());
            assertEquals(List.of("a:b:c"), variable(only, "c").interactions());
        }

        @Test
        void removedInteraction() {
            FormulaMetaData meta = build("y ~ a*b - a:b");

            assertEquals(List.of("y", "intercept", "a", "b"), meta.allGeneratedColumns());
            assertTrue(variable(meta, "a").interactions().isEmpty());
        }

        @Test
        @DisplayName("Removing b:a removes the a:b interaction")
        void removedInteractionInOtherOrder() {
            FormulaMetaData meta = build("y ~ a*b - b:a");

            assertEquals(List.of("y", "intercept", "a", "b"), meta.allGeneratedColumns());
            assertTrue(variable(meta, "b").interactions().isEmpty());
        }

        @Test
        @DisplayName("A product generating more columns than the policy allows is rejected")
        void productOverColumnLimit() {
            FormulaPolicy policy = FormulaPolicy.builder().maxGeneratedColumns(1000).build();

            FormulaBuildException e = assertThrows(FormulaBuildException.class,
                () -> build("y ~ poly(a, 40):poly(b, 40)", policy));
            assertTrue(e.getMessage().contains("more than 1000"));
            assertEquals("a", e.getVariable());

            assertEquals(402, build("y ~ poly(a, 20):poly(b, 20)", policy).allGeneratedColumns().size());
        }

        @Test
        @DisplayName("Columns accumulated across terms count towards the limit")
        void accumulatedColumnsOverLimit() {
            FormulaPolicy policy = FormulaPolicy.builder().maxGeneratedColumns(10).build();

            assertThrows(FormulaBuildException.class, () -> build("y ~ poly(a, 5) + poly(b, 5)", policy));
            assertEquals(List.of("y", "intercept", "a_poly_1", "a_poly_2", "a_poly_3", "a_poly_4",
                "b_poly_1", "b_poly_2", "b_poly_3", "b_poly_4"),
                build("y ~ poly(a, 4) + poly(b, 4)", policy).allGeneratedColumns());
        }

        @Test
        @DisplayName("Product columns are the cartesian product of the operands' columns")
        void transformedOperand() {
            FormulaMetaData meta = build("y ~ poly(x, 2):z");

            assertEquals(List.of("y", "intercept", "x_poly_1_z", "x_poly_2_z"), meta.allGeneratedColumns());
            assertEquals(List.of("poly(x, 2):z"), variable(meta, "z").interactions());
        }

        @Test
        void powerExpansion() {
            FormulaMetaData meta = build("y ~ (a + b + c)^2");
            assertEquals(List.of("y", "intercept", "a", "b", "c", "a_b", "a_c", "b_c"), formulaOrder(meta));
        }
    }

    @Nested
    @DisplayName("Transformations")
    class Transformations {

        @Test
        @DisplayName("poly(disp, 4)")
        void polynomial() {
            FormulaMetaData meta = build("mpg ~ poly(disp, 4)");
            Variable disp = variable(meta, "disp");

            assertEquals(VariableRole.FIXED_EFFECT, disp.role());
            assertEquals(List.of("disp_poly_1", "disp_poly_2", "disp_poly_3", "disp_poly_4"), disp.generatedColumns());
            Transformation poly = disp.transformations().get(0);
            assertEquals("poly", poly.function());
            assertEquals(Map.of("degree", 4, "orthogonal", true), poly.parameters());
            assertEquals(disp.generatedColumns(), poly.generatesColumns());
        }

        @Test
        void rawPolynomial() {
            Transformation poly = variable(build("y ~ poly(x, 2, raw = TRUE)"), "x").transformations().get(0);
            assertEquals(false, poly.parameters().get("orthogonal"));
        }

        @Test
        void polynomialWithoutDegree() {
            Variable x = variable(build("y ~ poly(x)"), "x");
            assertEquals(List.of("x_poly"), x.generatedColumns());
            assertTrue(x.transformations().get(0).parameters().isEmpty());
        }

        @Test
        void logarithm() {
            Variable x = variable(build("y ~ log(x, base = 2)"), "x");

            assertEquals(List.of("x_log"), x.generatedColumns());
            assertEquals(Map.of("base", 2L), x.transformations().get(0).parameters());
        }

        @Test
        @DisplayName("Nested calls compose from the inside out")
        void nestedCalls() {
            Variable x = variable(build("y ~ log(scale(x))"), "x");

            assertEquals(List.of("x_scale_log"), x.generatedColumns());
            assertEquals(List.of("scale", "log"), x.transformations().stream().map(Transformation::function).toList());
        }

        @Test
        @DisplayName("Generic calls record positional arguments and named options")
        void genericCall() {
            Transformation call = variable(build("y ~ s(x, 5, bs = \"cr\")"), "x").transformations().get(0);

            assertEquals("s", call.function());
            assertEquals(List.of("x_s"), call.generatesColumns());
            Map<String, Object> parameters = call.parameters();
            assertEquals("x", parameters.get("arg_0"));
            assertEquals(5L, parameters.get("arg_1"));
            assertEquals("cr", parameters.get("bs"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"y ~ poly(x, 0)", "y ~ poly(x, 2.5)", "y ~ poly(x, \"two\")",
            "y ~ poly(x, 99999999999)"})
        void invalidDegree(String formula) {
            assertThrows(FormulaBuildException.class, () -> build(formula));
        }

        @Test
        @DisplayName("A degree above the column limit is rejected before any column is generated")
        void degreeOverColumnLimit() {
            FormulaBuildException e = assertThrows(FormulaBuildException.class,
                () -> build("y ~ poly(x, 2000000000)"));

            assertTrue(e.getMessage().contains("too many columns"));
            assertTrue(e.getMessage().contains("DEFAULT_POLICY"));
        }
    }

    @Nested
    @DisplayName("Random effects")
    class RandomEffects {

        @Test
        void correlatedSlopeAndIntercept() {
            FormulaMetaData meta = build("y ~ x + (1 + x | g)");

            assertTrue(meta.isRandomEffectsModel());
            assertFalse(meta.hasUncorrelatedSlopesAndIntercepts());
            assertEquals(List.of("y", "intercept", "x", "g"), meta.allGeneratedColumns());

            RandomEffectInfo effect = variable(meta, "x").randomEffects().get(0);
            assertEquals(RandomEffectInfo.Kind.EFFECT, effect.kind());
            assertEquals("g", effect.groupingVariable());
            assertEquals(CorrelationKind.CORRELATED, effect.correlation());
            assertTrue(effect.correlated());
            assertTrue(effect.hasIntercept());
            assertTrue(effect.variables().isEmpty());

            Variable g = variable(meta, "g");
            assertEquals(VariableRole.GROUPING_VARIABLE, g.role());
            RandomEffectInfo grouping = g.randomEffects().get(0);
            assertEquals(RandomEffectInfo.Kind.GROUPING, grouping.kind());
            assertEquals(List.of("x"), grouping.variables());
        }

        @Test
        @DisplayName("Effects are registered before their grouping factor")
        void registrationOrder() {
            FormulaMetaData meta = build("y ~ (z | g)");

            assertEquals(2, variable(meta, "z").id());
            assertEquals(VariableRole.RANDOM_EFFECT, variable(meta, "z").role());
            assertEquals(3, variable(meta, "g").id());
        }

        @Test
        void uncorrelated() {
            FormulaMetaData meta = build("y ~ x + (x || g)");

            assertTrue(meta.hasUncorrelatedSlopesAndIntercepts());
            RandomEffectInfo grouping = variable(meta, "g").randomEffects().get(0);
            assertEquals(CorrelationKind.UNCORRELATED, grouping.correlation());
            assertFalse(grouping.correlated());
        }

        @Test
        void crossParameter() {
            RandomEffectInfo grouping = variable(build("y ~ (1 |p| g)"), "g").randomEffects().get(0);

            assertEquals(CorrelationKind.CROSS_PARAMETER, grouping.correlation());
            assertEquals("p", grouping.correlationId());
            assertTrue(grouping.correlated());
        }

        @Test
        void grOptions() {
            FormulaMetaData meta = build("y ~ (1 | gr(g, cor = FALSE, dist = student))");
            RandomEffectInfo grouping = variable(meta, "g").randomEffects().get(0);

            assertEquals(Map.of("cor", false, "dist", "student"), grouping.groupingOptions());
            assertTrue(meta.hasUncorrelatedSlopesAndIntercepts());
        }

        @Test
        @DisplayName("Every variable of a compound grouping factor is a grouping variable")
        void compoundGroups() {
            FormulaMetaData meta = build("y ~ (1 | school/class) + (1 | mm(s1, s2))");

            for (String name : List.of("school", "class", "s1", "s2")) {
                assertEquals(VariableRole.GROUPING_VARIABLE, variable(meta, name).role(), name);
            }
            assertEquals("school/class", variable(meta, "class").randomEffects().get(0).groupingVariable());
            assertEquals("mm(s1, s2)", variable(meta, "s2").randomEffects().get(0).groupingVariable());
        }

        @Test
        void interactionEffects() {
            FormulaMetaData meta = build("y ~ (a*b | g)");

            RandomEffectInfo grouping = variable(meta, "g").randomEffects().get(0);
            assertTrue(grouping.includesInteractions());
            assertEquals(List.of("a", "b"), grouping.variables());
            assertTrue(meta.allGeneratedColumns().contains("a_b"));
        }

        @Test
        void interceptOnlyTerm() {
            FormulaMetaData meta = build("y ~ x + (1 | g)");

            Variable g = variable(meta, "g");
            assertTrue(g.randomEffects().get(0).variables().isEmpty());
            assertTrue(g.randomEffects().get(0).hasIntercept());
        }
    }

    @Nested
    @DisplayName("Family and auxiliary parameters")
    class Programs {

        @Test
        void familyAssignment() {
            assertEquals(Family.POISSON, build("y ~ x, family = poisson").family());
            assertEquals(Family.STUDENT, build("y ~ x, family = \"student\"").family());
        }

        @Test
        @DisplayName("Ordinal families have no intercept unless one is written")
        void ordinalFamily() {
            FormulaMetaData meta = build("y ~ x, family = cumulative");

            assertFalse(meta.hasIntercept());
            assertEquals(List.of("y", "x"), meta.allGeneratedColumns());
            assertThrows(FormulaBuildException.class, () -> build("y ~ 1 + x, family = cumulative"));
        }

        @Test
        void auxiliaryParameter() {
            FormulaMetaData meta = build("y ~ x, sigma ~ z");

            assertEquals(List.of("y", "x", "z"), meta.columnNames());
            assertTrue(meta.variable("z").isEmpty());
            AuxiliaryParameter sigma = meta.auxiliaryParameters().get(0);
            assertEquals("sigma", sigma.parameter());
            assertTrue(sigma.hasIntercept());
            assertEquals(List.of("z"), sigma.columnNames());
            assertEquals(List.of("intercept", "z"), sigma.generatedColumns());

            assertFalse(build("y ~ x, sigma ~ 0 + z").auxiliaryParameters().get(0).hasIntercept());
        }

        @Test
        void sharedAuxiliaryColumns() {
            assertEquals(List.of("y", "x"), build("y ~ x, sigma ~ x").columnNames());
        }
    }

    @Nested
    @DisplayName("Build errors")
    class BuildErrors {

        @ParameterizedTest
        @ValueSource(strings = {
            "y ~ y + x",
            "mvbind(y, y) ~ x",
            "y ~ (g | g)",
            "y ~ a:b + a_b",
            "y ~ intercept",
            "y ~ x, family = unknown",
            "y ~ x, family = poisson, family = gamma",
            "y ~ x, link = logit",
            "y ~ x, y ~ z",
            "y ~ x, sigma ~ z, sigma ~ w"
        })
        void rejected(String formula) {
            FormulaBuildException e = assertThrows(FormulaBuildException.class, () -> build(formula));
            assertEquals(formula, e.getFormula());
        }

        @Test
        void effectAlsoGroupingFactor() {
            FormulaBuildException e = assertThrows(FormulaBuildException.class, () -> build("y ~ (g | g)"));
            assertEquals("g", e.getVariable());
        }

        @Test
        void duplicateColumn() {
            FormulaBuildException e = assertThrows(FormulaBuildException.class, () -> build("y ~ a:b + a_b"));
            assertEquals("column 'a_b' is generated by both 'a' and 'a_b'", e.getMessage());
        }

        @Test
        void interceptVariableWithoutModelIntercept() {
            assertEquals(List.of("y", "intercept"), build("y ~ 0 + intercept").allGeneratedColumns());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "y ~ x + z",
        "y ~ x + 1",
        "mpg ~ wt*hp + poly(disp, 3)",
        "y ~ a*b*c - a:b:c + (1 + x || g)",
        "mvbind(y1, y2) ~ log(x) + (1 |p| subject)",
        "y ~ 0 + s(x, 4):z"
    })
    @DisplayName("Both column orders hold the same columns, numbered from 1")
    void columnOrdersAgree(String formula) {
        FormulaMetaData meta = build(formula);
        List<String> byId = meta.allGeneratedColumns();
        Map<Integer, String> byPosition = meta.allGeneratedColumnsFormulaOrder();

        assertEquals(byId.size(), byPosition.size());
        assertEquals(new HashSet<>(byId), new HashSet<>(byPosition.values()));
        assertEquals(byId.size(), new HashSet<>(byId).size());
        for (int i = 1; i <= byId.size(); i++) {
            assertTrue(byPosition.containsKey(i), "missing position " + i);
        }
    }
}
