package io.github.cyfko.wilkinson.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A distributional parameter modelled by its own formula, such as {@code sigma ~ x}.
 *
 * @param parameter        parameter name
 * @param hasIntercept     whether the parameter formula has an intercept
 * @param columnNames      raw columns referenced by the parameter formula
 * @param generatedColumns generated columns in formula order, {@code intercept} included
 * @since 1.0.0
 */
public record AuxiliaryParameter(String parameter, boolean hasIntercept, List<String> columnNames,
                                 List<String> generatedColumns) {

    public AuxiliaryParameter {
        Objects.requireNonNull(parameter, "parameter");
        columnNames = List.copyOf(columnNames);
        generatedColumns = List.copyOf(generatedColumns);
    }
}
