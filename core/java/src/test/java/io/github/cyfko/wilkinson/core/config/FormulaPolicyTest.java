package io.github.cyfko.wilkinson.core.config;

import io.github.cyfko.wilkinson.core.model.Family;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPolicyTest {

    @Test
    @DisplayName("Presets carry their limits and name")
    void presets() {
        FormulaPolicy defaults = FormulaPolicy.defaults();
        assertEquals(5000, defaults.maxFormulaLength());
        assertEquals(32, defaults.maxNestingDepth());
        assertEquals(10000, defaults.maxGeneratedColumns());
        assertEquals(Family.GAUSSIAN, defaults.defaultFamily());
        assertEquals("DEFAULT_POLICY", defaults.policyName());

        assertEquals(1000, FormulaPolicy.strict().maxFormulaLength());
        assertEquals(8, FormulaPolicy.strict().maxNestingDepth());
        assertEquals(20000, FormulaPolicy.relaxed().maxFormulaLength());
        assertEquals(128, FormulaPolicy.relaxed().maxNestingDepth());
        assertEquals(1000, FormulaPolicy.strict().maxGeneratedColumns());
        assertEquals(100000, FormulaPolicy.relaxed().maxGeneratedColumns());
    }

    @Test
    @DisplayName("Builder starts from the defaults under a custom name")
    void builder() {
        FormulaPolicy policy = FormulaPolicy.builder()
            .maxFormulaLength(200)
            .maxGeneratedColumns(50)
            .defaultFamily(Family.BERNOULLI)
            .build();

        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(200, policy.maxFormulaLength());
        assertEquals(32, policy.maxNestingDepth());
        assertEquals(50, policy.maxGeneratedColumns());
        assertEquals(Family.BERNOULLI, policy.defaultFamily());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void nonPositiveLimits(int limit) {
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxFormulaLength(limit).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxNestingDepth(limit).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxGeneratedColumns(limit).build());
    }

    @Test
    void missingFields() {
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().policyName(" ").build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().defaultFamily(null).build());
    }
}
