package io.github.cyfko.wilkinson.core.ast;

import java.util.Objects;

/**
 * Entry following the main formula, separated by commas.
 *
 * @since 1.0.0
 */
public sealed interface ProgramEntry {

    /**
     * @return the parameter or key this entry is about
     */
    String name();

    /**
     * Distributional parameter formula, e.g. {@code sigma ~ x}.
     *
     * @param name    parameter name
     * @param formula the one-sided formula of the parameter
     */
    record ParameterFormula(String name, Formula formula) implements ProgramEntry {
        public ParameterFormula {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(formula, "formula");
        }
    }

    /**
     * Top-level assignment, e.g. {@code family = poisson}.
     *
     * @param name  assigned key
     * @param value assigned value
     */
    record Assignment(String name, Argument value) implements ProgramEntry {
        public Assignment {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}
