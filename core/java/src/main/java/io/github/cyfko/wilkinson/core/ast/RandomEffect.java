package io.github.cyfko.wilkinson.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A group-level term such as {@code (1 + x | g)} or {@code (0 + x || gr(g, by = v))}.
 *
 * @param effects      effect terms left of the bar, intercept markers excluded
 * @param group        grouping expression right of the bar
 * @param correlation  correlation structure
 * @param hasIntercept whether the group-level intercept is kept ({@code 0}/{@code -1} remove it)
 * @since 1.0.0
 */
public record RandomEffect(List<Term> effects, GroupExpression group, Correlation correlation,
                           boolean hasIntercept) implements Term {

    public RandomEffect {
        effects = List.copyOf(effects);
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(correlation, "correlation");
    }

    @Override
    public String label() {
        String lhs = effects.stream().map(Term::label).collect(Collectors.joining(" + "));
        if (!hasIntercept) {
            lhs = lhs.isEmpty() ? "0" : "0 + " + lhs;
        } else if (lhs.isEmpty()) {
            lhs = "1";
        }
        return "(" + lhs + " " + correlation.bars() + " " + group.label() + ")";
    }
}
