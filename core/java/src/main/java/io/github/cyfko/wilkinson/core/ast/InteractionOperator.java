package io.github.cyfko.wilkinson.core.ast;

/**
 * Junction between two operands of an {@link Interaction}.
 *
 * @since 1.0.0
 */
public enum InteractionOperator {
    /** {@code *}: main effects plus interaction. */
    FULL("*"),
    /** {@code :}: interaction only. */
    ONLY(":");

    private final String symbol;

    InteractionOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
