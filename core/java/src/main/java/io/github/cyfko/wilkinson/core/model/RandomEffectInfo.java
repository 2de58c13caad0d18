package io.github.cyfko.wilkinson.core.model;

import io.github.cyfko.wilkinson.core.ast.CorrelationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Random-effect membership of one variable in one group-level term.
 *
 * @param kind                 whether the variable is the grouping factor or an effect
 * @param groupingVariable     label of the group, e.g. {@code subject} or {@code g1:g2}
 * @param correlation          correlation kind of the term
 * @param correlationId        cross-parameter id, or {@code null}
 * @param correlated           whether the term's effects are correlated
 * @param hasIntercept         whether the term keeps its group-level intercept
 * @param variables            effect variables of the term (grouping records only, empty otherwise)
 * @param includesInteractions whether the term contains interaction effects
 * @param groupingOptions      options given through {@code gr(...)}, empty otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RandomEffectInfo(
    Kind kind,
    String groupingVariable,
    CorrelationKind correlation,
    String correlationId,
    boolean correlated,
    boolean hasIntercept,
    List<String> variables,
    boolean includesInteractions,
    Map<String, Object> groupingOptions
) {

    public RandomEffectInfo {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(groupingVariable, "groupingVariable");
        Objects.requireNonNull(correlation, "correlation");
        variables = List.copyOf(variables);
        groupingOptions = Collections.unmodifiableMap(new LinkedHashMap<>(groupingOptions));
    }

    public enum Kind {
        GROUPING("grouping"),
        EFFECT("effect");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
