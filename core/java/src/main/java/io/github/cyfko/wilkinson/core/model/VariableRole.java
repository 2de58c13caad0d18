package io.github.cyfko.wilkinson.core.model;

/**
 * Structural role of a variable in a formula.
 *
 * @since 1.0.0
 */
public enum VariableRole {
    /** Left-hand side variable. */
    RESPONSE("Response"),
    /** Wrapped in a transformation or part of an interaction. */
    FIXED_EFFECT("FixedEffect"),
    /** Right of the bar in a random-effect term. */
    GROUPING_VARIABLE("GroupingVariable"),
    /** Left of the bar in a random-effect term. */
    RANDOM_EFFECT("RandomEffect"),
    /** Used as a bare, standalone term. */
    IDENTITY("Identity");

    private final String label;

    VariableRole(String label) {
        this.label = label;
    }

    /**
     * @return the output name of the role, e.g. {@code "FixedEffect"}
     */
    public String label() {
        return label;
    }
}
