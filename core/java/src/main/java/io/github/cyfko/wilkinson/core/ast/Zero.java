package io.github.cyfko.wilkinson.core.ast;

/**
 * Intercept suppression, written {@code 0} or {@code -1}.
 *
 * @param negatedOne true when written as {@code -1}
 * @since 1.0.0
 */
public record Zero(boolean negatedOne) implements Term {

    @Override
    public String label() {
        return negatedOne ? "-1" : "0";
    }
}
