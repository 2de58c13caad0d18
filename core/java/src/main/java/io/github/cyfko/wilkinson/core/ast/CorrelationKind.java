package io.github.cyfko.wilkinson.core.ast;

/**
 * How the effects of one random-effect term are correlated.
 *
 * @since 1.0.0
 */
public enum CorrelationKind {
    /** {@code (x | g)} */
    CORRELATED,
    /** {@code (x || g)} */
    UNCORRELATED,
    /** {@code (x |ID| g)}: correlated with every other term sharing the same id. */
    CROSS_PARAMETER
}
