package io.github.cyfko.wilkinson.core.ast;

import java.util.Objects;

/**
 * A bare variable reference.
 *
 * @param name the identifier as written
 * @since 1.0.0
 */
public record ColumnName(String name) implements Term {

    public ColumnName {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String label() {
        return name;
    }
}
