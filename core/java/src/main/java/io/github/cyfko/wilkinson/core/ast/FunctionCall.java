package io.github.cyfko.wilkinson.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A transformation call such as {@code poly(x, 3)} or {@code log(scale(x))}.
 *
 * @param name      function name
 * @param arguments ordered arguments
 * @since 1.0.0
 */
public record FunctionCall(String name, List<Argument> arguments) implements Term {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
    }

    @Override
    public String label() {
        return arguments.stream()
            .map(Argument::render)
            .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
