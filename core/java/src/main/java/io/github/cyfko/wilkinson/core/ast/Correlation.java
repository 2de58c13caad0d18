package io.github.cyfko.wilkinson.core.ast;

import java.util.Objects;

/**
 * Correlation structure of a random-effect term.
 *
 * @param kind correlation kind
 * @param id   cross-parameter id, only set for {@link CorrelationKind#CROSS_PARAMETER}
 * @since 1.0.0
 */
public record Correlation(CorrelationKind kind, String id) {

    public Correlation {
        Objects.requireNonNull(kind, "kind");
        if ((kind == CorrelationKind.CROSS_PARAMETER) != (id != null)) {
            throw new IllegalArgumentException("A correlation id is required for, and only for, cross-parameter terms");
        }
    }

    public static Correlation correlated() {
        return new Correlation(CorrelationKind.CORRELATED, null);
    }

    public static Correlation uncorrelated() {
        return new Correlation(CorrelationKind.UNCORRELATED, null);
    }

    public static Correlation crossParameter(String id) {
        return new Correlation(CorrelationKind.CROSS_PARAMETER, id);
    }

    /**
     * @return the bar syntax of this correlation: {@code |}, {@code ||} or {@code |id|}
     */
    public String bars() {
        switch (kind) {
            case UNCORRELATED:
                return "||";
            case CROSS_PARAMETER:
                return "|" + id + "|";
            default:
                return "|";
        }
    }
}
