package io.github.cyfko.wilkinson.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function applied to a variable and the columns it generates.
 *
 * @param function         function name, e.g. {@code poly}
 * @param parameters       ordered parameters ({@code degree}, {@code orthogonal}, {@code arg_2}, ...)
 * @param generatesColumns generated column names in order
 * @since 1.0.0
 */
public record Transformation(String function, Map<String, Object> parameters, List<String> generatesColumns) {

    public Transformation {
        Objects.requireNonNull(function, "function");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        generatesColumns = List.copyOf(generatesColumns);
    }
}
