package io.github.cyfko.wilkinson.core.ast;

/**
 * The explicit intercept term {@code 1}.
 *
 * @since 1.0.0
 */
public record Intercept() implements Term {

    @Override
    public String label() {
        return "1";
    }
}
