package io.github.cyfko.wilkinson.core.ast;

import java.util.List;

/**
 * Left-hand side of a formula.
 *
 * @param names        response variables in listed order
 * @param multivariate true when written as {@code bind(...)} or {@code mvbind(...)}
 * @since 1.0.0
 */
public record Response(List<String> names, boolean multivariate) {

    public Response {
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("A response needs at least one variable");
        }
    }
}
