package io.github.cyfko.wilkinson.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A flat interaction chain such as {@code a*b:c}.
 * <p>
 * All operands of one chain are held by a single node; {@code operators.get(i)} joins
 * {@code operands.get(i)} and {@code operands.get(i + 1)}.
 * </p>
 *
 * @param operands  atomic operands (column names or function calls), at least two
 * @param operators one operator per junction
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Interaction(List<Term> operands, List<InteractionOperator> operators) implements Term {

    public Interaction {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        if (operands.size() < 2) {
            throw new IllegalArgumentException("An interaction needs at least two operands, got: " + operands.size());
        }
        if (operators.size() != operands.size() - 1) {
            throw new IllegalArgumentException("Expected " + (operands.size() - 1)
                + " operators for " + operands.size() + " operands, got: " + operators.size());
        }
    }

    /**
     * Builds an interaction-only ({@code :}) product of the given operands.
     *
     * @param operands at least two atomic operands
     * @return the product term
     */
    public static Interaction product(List<Term> operands) {
        return new Interaction(operands, Collections.nCopies(operands.size() - 1, InteractionOperator.ONLY));
    }

    /**
     * Whether every junction is {@code :}.
     *
     * @return true if the chain contributes only its full product
     */
    public boolean isProductOnly() {
        return operators.stream().allMatch(op -> op == InteractionOperator.ONLY);
    }

    /**
     * @return the number of {@code *}-separated factors of the chain
     */
    public int factorCount() {
        int factors = 1;
        for (InteractionOperator operator : operators) {
            if (operator == InteractionOperator.FULL) {
                factors++;
            }
        }
        return factors;
    }

    /**
     * Upper bound of the number of terms {@link #combine(List, int)} yields for
     * {@code factorCount} factors, computed without enumerating them.
     *
     * @param factorCount number of factors
     * @param maxOrder    largest number of factors combined in one term
     * @return the term count, or {@link Long#MAX_VALUE} when it does not fit in a long
     */
    public static long expansionSize(int factorCount, int maxOrder) {
        int limit = Math.min(maxOrder, factorCount);
        long total = 0;
        long binomial = 1;
        for (int k = 1; k <= limit; k++) {
            try {
                binomial = Math.multiplyExact(binomial, (long) (factorCount - k + 1)) / k;
                total = Math.addExact(total, binomial);
            } catch (ArithmeticException overflow) {
                return Long.MAX_VALUE;
            }
        }
        return total;
    }

    /**
     * Expands the chain into the model terms it stands for.
     * <p>
     * The chain is split at every {@code *} into factors (each factor being a {@code :} product).
     * Every non-empty subset of factors yields one term, ordered by subset size and then by
     * factor position: {@code a*b*c} gives {@code a, b, c, a:b, a:c, b:c, a:b:c}, {@code a*b:c}
     * gives {@code a, b:c, a:b:c} and {@code a:b:c} gives only {@code a:b:c}.
     * </p>
     *
     * @return the expanded terms; single-operand products are returned as the bare operand
     */
    public List<Term> expand() {
        List<List<Term>> factors = new ArrayList<>();
        List<Term> current = new ArrayList<>();
        current.add(operands.get(0));
        for (int i = 0; i < operators.size(); i++) {
            if (operators.get(i) == InteractionOperator.FULL) {
                factors.add(current);
                current = new ArrayList<>();
            }
            current.add(operands.get(i + 1));
        }
        factors.add(current);
        return combine(factors, factors.size());
    }

    /**
     * Combines factors into every product of at most {@code maxOrder} factors, ordered by size
     * then position. Terms with the same {@link Term#key()} are emitted once.
     *
     * @param factors  ordered factors, each a list of atomic operands
     * @param maxOrder largest number of factors combined in one term
     * @return the product terms
     */
    public static List<Term> combine(List<List<Term>> factors, int maxOrder) {
        List<Term> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int limit = Math.min(maxOrder, factors.size());
        for (int size = 1; size <= limit; size++) {
            for (int[] subset : subsets(factors.size(), size)) {
                Set<Term> atoms = new LinkedHashSet<>();
                for (int index : subset) {
                    atoms.addAll(factors.get(index));
                }
                Term term = atoms.size() == 1 ? atoms.iterator().next() : product(new ArrayList<>(atoms));
                if (seen.add(term.key())) {
                    result.add(term);
                }
            }
        }
        return result;
    }

    private static List<int[]> subsets(int n, int size) {
        List<int[]> out = new ArrayList<>();
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = i;
        }
        while (true) {
            out.add(indices.clone());
            int i = size - 1;
            while (i >= 0 && indices[i] == n - size + i) {
                i--;
            }
            if (i < 0) {
                return out;
            }
            indices[i]++;
            for (int j = i + 1; j < size; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }

    /**
     * Products are keyed by their sorted distinct operand keys; chains containing {@code *}
     * by their label.
     */
    @Override
    public String key() {
        if (!isProductOnly()) {
            return label();
        }
        return operands.stream().map(Term::key).distinct().sorted().collect(Collectors.joining(":"));
    }

    @Override
    public String label() {
        StringBuilder sb = new StringBuilder(operands.get(0).label());
        for (int i = 0; i < operators.size(); i++) {
            sb.append(operators.get(i).symbol()).append(operands.get(i + 1).label());
        }
        return sb.toString();
    }
}
