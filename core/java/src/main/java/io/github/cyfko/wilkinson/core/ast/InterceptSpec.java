package io.github.cyfko.wilkinson.core.ast;

/**
 * Intercept status of a formula as written.
 *
 * @since 1.0.0
 */
public enum InterceptSpec {
    /** Neither {@code 1} nor {@code 0}/{@code -1} was written. */
    IMPLICIT,
    /** {@code 1} was written. */
    PRESENT,
    /** {@code 0} or {@code -1} was written. */
    ABSENT
}
