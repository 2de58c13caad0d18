package io.github.cyfko.wilkinson.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Right-hand side of the bar in a random-effect term.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface GroupExpression {

    /**
     * @return the grouping label used to identify the group, e.g. {@code g1:g2}
     */
    String label();

    /**
     * @return every variable the grouping factor is made of, in textual order
     */
    List<String> groupingVariables();

    /**
     * {@code (x | g)}
     *
     * @param name grouping variable
     */
    record SimpleGroup(String name) implements GroupExpression {
        public SimpleGroup {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String label() {
            return name;
        }

        @Override
        public List<String> groupingVariables() {
            return List.of(name);
        }
    }

    /**
     * {@code (x | gr(g, cor = FALSE, by = v))}
     *
     * @param name    grouping variable
     * @param options grouping options
     */
    record GrGroup(String name, GrOptions options) implements GroupExpression {
        public GrGroup {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(options, "options");
        }

        @Override
        public String label() {
            return name;
        }

        @Override
        public List<String> groupingVariables() {
            return List.of(name);
        }
    }

    /**
     * Multi-membership grouping {@code (1 | mm(g1, g2))}.
     *
     * @param names member grouping variables, at least two
     */
    record MultiMembershipGroup(List<String> names) implements GroupExpression {
        public MultiMembershipGroup {
            names = List.copyOf(names);
        }

        @Override
        public String label() {
            return names.stream().collect(Collectors.joining(", ", "mm(", ")"));
        }

        @Override
        public List<String> groupingVariables() {
            return names;
        }
    }

    /**
     * Crossed grouping {@code (1 | g1:g2)}.
     *
     * @param names factors of the grouping interaction
     */
    record InteractionGroup(List<String> names) implements GroupExpression {
        public InteractionGroup {
            names = List.copyOf(names);
        }

        @Override
        public String label() {
            return String.join(":", names);
        }

        @Override
        public List<String> groupingVariables() {
            return names;
        }
    }

    /**
     * Nested grouping {@code (1 | school/class)}.
     *
     * @param names outer to inner grouping variables
     */
    record NestedGroup(List<String> names) implements GroupExpression {
        public NestedGroup {
            names = List.copyOf(names);
        }

        @Override
        public String label() {
            return String.join("/", names);
        }

        @Override
        public List<String> groupingVariables() {
            return names;
        }
    }
}
