package io.github.cyfko.wilkinson.core.ast;

/**
 * Node of the right-hand side of a formula.
 * <p>
 * The set of variants is closed; consumers dispatch on it exhaustively with
 * {@code instanceof} chains.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Term permits ColumnName, FunctionCall, Interaction, Intercept, Zero, RandomEffect {

    /**
     * Canonical textual rendering of the term, used to name interactions ({@code a:b}) and
     * their columns.
     *
     * @return the label of this term
     */
    String label();

    /**
     * Identity of the term within a model, used to match removed terms. Products compare by
     * operand set, so {@code b:a} and {@code a:b} share a key.
     *
     * @return the key of this term
     */
    default String key() {
        return label();
    }
}
