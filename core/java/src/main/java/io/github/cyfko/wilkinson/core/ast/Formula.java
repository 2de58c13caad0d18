package io.github.cyfko.wilkinson.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One {@code lhs ~ rhs} formula.
 *
 * @param response     left-hand side, {@code null} for a one-sided formula
 * @param rhs          right-hand terms in textual order, intercept markers included
 * @param droppedTerms keys of terms removed with {@code -}, see {@link Term#key()}
 * @param intercept    validated intercept status
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Formula(Response response, List<Term> rhs, Set<String> droppedTerms, InterceptSpec intercept) {

    public Formula {
        rhs = List.copyOf(rhs);
        droppedTerms = Set.copyOf(droppedTerms);
        Objects.requireNonNull(intercept, "intercept");
    }
}
