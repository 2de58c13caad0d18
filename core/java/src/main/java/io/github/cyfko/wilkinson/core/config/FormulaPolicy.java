package io.github.cyfko.wilkinson.core.config;

import io.github.cyfko.wilkinson.core.model.Family;

/**
 * Limits and defaults applied by the formula parser.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: maximum character length of the formula text (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: maximum depth of nested parentheses and calls (default: 32)</li>
 *   <li><strong>maxGeneratedColumns</strong>: maximum number of terms an expansion may produce and of
 *       columns a formula may generate (default: 10000)</li>
 *   <li><strong>defaultFamily</strong>: family reported when the formula has no {@code family =} (default: gaussian)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (for formulas received from untrusted clients)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (for generated model specifications)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxFormulaLength(2000)
 *     .defaultFamily(Family.POISSON)
 *     .build();
 * }</pre>
 *
 * @param policyName       name reported in limit violations
 * @param maxFormulaLength maximum number of characters
 * @param maxNestingDepth  maximum parenthesis nesting depth
 * @param maxGeneratedColumns maximum number of expanded terms and generated columns
 * @param defaultFamily    family used when none is assigned
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxNestingDepth,
    int maxGeneratedColumns,
    Family defaultFamily
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a limit is not positive or a field is missing
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxGeneratedColumns <= 0) {
            throw new IllegalArgumentException("maxGeneratedColumns must be positive, got: " + maxGeneratedColumns);
        }
        if (defaultFamily == null) {
            throw new IllegalArgumentException("defaultFamily is required");
        }
    }

    /**
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>Max Generated Columns: 10000</li>
     *   <li>Default Family: gaussian</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 32, 10000, Family.GAUSSIAN);
    }

    /**
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 8</li>
     *   <li>Max Generated Columns: 1000</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 8, 1000, Family.GAUSSIAN);
    }

    /**
     * <ul>
     *   <li>Max Formula Length: 20000 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     *   <li>Max Generated Columns: 100000</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 128, 100000, Family.GAUSSIAN);
    }

    /**
     * Builder initialized with the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private int _maxNestingDepth = 32;
        private int _maxGeneratedColumns = 10000;
        private Family _defaultFamily = Family.GAUSSIAN;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxNestingDepth, _maxGeneratedColumns, _defaultFamily);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxGeneratedColumns(int maxGeneratedColumns) { this._maxGeneratedColumns = maxGeneratedColumns; return this; }
        public Builder defaultFamily(Family defaultFamily) { this._defaultFamily = defaultFamily; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
