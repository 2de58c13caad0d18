package io.github.cyfko.wilkinson.core.semantic;

import io.github.cyfko.wilkinson.core.ast.Argument;
import io.github.cyfko.wilkinson.core.ast.ColumnName;
import io.github.cyfko.wilkinson.core.ast.CorrelationKind;
import io.github.cyfko.wilkinson.core.ast.FunctionCall;
import io.github.cyfko.wilkinson.core.ast.GroupExpression;
import io.github.cyfko.wilkinson.core.ast.Intercept;
import io.github.cyfko.wilkinson.core.ast.Interaction;
import io.github.cyfko.wilkinson.core.ast.RandomEffect;
import io.github.cyfko.wilkinson.core.ast.Term;
import io.github.cyfko.wilkinson.core.ast.Zero;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;
import io.github.cyfko.wilkinson.core.model.Transformation;
import io.github.cyfko.wilkinson.core.model.VariableRole;
import io.github.cyfko.wilkinson.core.semantic.VariableRegistry.VariableRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Left-to-right walk over the right-hand terms of one formula, feeding a {@link VariableRegistry}.
 * <p>
 * Column naming:
 * </p>
 * <ul>
 *   <li>bare variable {@code x}: {@code x}</li>
 *   <li>{@code poly(x, k)}: {@code x_poly_1} .. {@code x_poly_k}; without a degree, {@code x_poly}</li>
 *   <li>any other call {@code f(x, ...)}: {@code x_f}; nested calls compose inside out,
 *       {@code log(scale(x))} giving {@code x_scale_log}</li>
 *   <li>interaction {@code a:b}: the {@code _}-joined product of the operands' columns,
 *       attributed to the first operand's variable</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class TermWalker {

    private static final Logger log = Logger.getLogger(TermWalker.class.getName());

    private final VariableRegistry registry;
    private final Set<String> dropped;
    private final String formula;
    private boolean randomEffects;
    private boolean uncorrelated;

    TermWalker(VariableRegistry registry, Set<String> dropped, String formula) {
        this.registry = registry;
        this.dropped = dropped;
        this.formula = formula;
    }

    void walk(List<Term> terms) {
        for (Term term : terms) {
            if (term instanceof Intercept) {
                registry.markIntercept();
            } else if (term instanceof Zero) {
                continue;
            } else if (term instanceof RandomEffect) {
                randomEffect((RandomEffect) term);
            } else if (term instanceof Interaction) {
                interaction((Interaction) term, VariableRole.FIXED_EFFECT, dropped);
            } else if (dropped.contains(term.key())) {
                log.fine(() -> String.format("Term '%s' removed from '%s'", term.label(), formula));
            } else {
                emit(evaluate(term, VariableRole.IDENTITY));
            }
        }
    }

    boolean sawRandomEffects() {
        return randomEffects;
    }

    boolean sawUncorrelatedTerm() {
        return uncorrelated;
    }

    // ---------------------------------------------------------------- fixed terms

    /**
     * Walks the expansion of an interaction chain.
     *
     * @return the variables taking part in the emitted terms, and the interaction labels
     */
    private Participants interaction(Interaction chain, VariableRole role, Set<String> skip) {
        Participants participants = new Participants();
        for (Term term : chain.expand()) {
            if (skip.contains(term.key())) {
                log.fine(() -> String.format("Term '%s' removed from '%s'", term.label(), formula));
                continue;
            }
            if (term instanceof Interaction) {
                Evaluated product = product((Interaction) term, role);
                if (product != null) {
                    participants.add(product);
                    participants.interactions.add(term.label());
                }
            } else {
                Evaluated main = evaluate(term, role);
                emit(main);
                participants.add(main);
            }
        }
        return participants;
    }

    private Evaluated product(Interaction product, VariableRole role) {
        List<Evaluated> parts = new ArrayList<>();
        for (Term operand : product.operands()) {
            Evaluated part = evaluate(operand, role);
            if (part == null) {
                log.fine(() -> String.format("Interaction '%s' skipped: '%s' references no variable",
                    product.label(), operand.label()));
                return null;
            }
            parts.add(part);
        }

        long size = 1;
        for (Evaluated part : parts) {
            size = saturatedProduct(size, part.columns.size());
        }
        registry.checkColumnCount(size, parts.get(0).owner.name);

        List<String> columns = List.of("");
        Set<VariableRecord> variables = new LinkedHashSet<>();
        for (Evaluated part : parts) {
            List<String> combined = new ArrayList<>();
            for (String prefix : columns) {
                for (String column : part.columns) {
                    combined.add(prefix.isEmpty() ? column : prefix + "_" + column);
                }
            }
            columns = combined;
            variables.addAll(part.variables);
        }

        String label = product.label();
        variables.forEach(record -> record.addInteraction(label));
        Evaluated result = new Evaluated(parts.get(0).owner, columns, variables);
        emit(result);
        return result;
    }

    private static long saturatedProduct(long left, long right) {
        try {
            return Math.multiplyExact(left, right);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Resolves an atomic term to its variables and columns, registering the variables.
     *
     * @return the evaluation, or null for a call without any variable argument
     */
    private Evaluated evaluate(Term atom, VariableRole role) {
        if (atom instanceof ColumnName) {
            String name = ((ColumnName) atom).name();
            VariableRecord record = registry.register(name, role);
            return new Evaluated(record, List.of(name), List.of(record));
        }
        if (atom instanceof FunctionCall) {
            return call((FunctionCall) atom, role == VariableRole.IDENTITY ? VariableRole.FIXED_EFFECT : role);
        }
        throw new FormulaBuildException("'" + atom.label() + "' cannot be used as a variable", formula, null);
    }

    private Evaluated call(FunctionCall call, VariableRole role) {
        Evaluated primary = null;
        Set<VariableRecord> referenced = new LinkedHashSet<>();
        for (Argument argument : call.arguments()) {
            if (!(argument instanceof Argument.TermArgument)) {
                continue;
            }
            Evaluated inner = evaluate(((Argument.TermArgument) argument).term(), role);
            if (inner == null) {
                continue;
            }
            if (primary == null) {
                primary = inner;
            }
            referenced.addAll(inner.variables);
        }

        if (primary == null) {
            log.fine(() -> String.format("Call '%s' in '%s' references no variable and generates no column",
                call.label(), formula));
            return null;
        }

        Integer degree = "poly".equals(call.name()) ? polyDegree(call) : null;
        if (degree != null) {
            registry.checkColumnCount(saturatedProduct(degree, primary.columns.size()), primary.owner.name);
        }
        List<String> columns = new ArrayList<>();
        for (String base : primary.columns) {
            if ("poly".equals(call.name()) && degree != null) {
                for (int i = 1; i <= degree; i++) {
                    columns.add(base + "_poly_" + i);
                }
            } else {
                columns.add(base + "_" + call.name());
            }
        }

        Transformation transformation = new Transformation(call.name(), parameters(call, degree), columns);
        referenced.forEach(record -> record.addTransformation(transformation));
        return new Evaluated(primary.owner, columns, referenced);
    }

    private Integer polyDegree(FunctionCall call) {
        Argument degree = null;
        int positional = 0;
        for (Argument argument : call.arguments()) {
            if (argument instanceof Argument.NamedArgument) {
                Argument.NamedArgument named = (Argument.NamedArgument) argument;
                if ("degree".equals(named.key())) {
                    degree = named.value();
                }
            } else if (++positional == 2) {
                degree = argument;
            }
        }
        if (degree == null) {
            return null;
        }
        if (!(degree instanceof Argument.NumericArgument) || !((Argument.NumericArgument) degree).isInteger()) {
            throw new FormulaBuildException("poly() degree must be an integer, got: " + degree.render(), formula, null);
        }
        int value;
        try {
            value = Integer.parseInt(((Argument.NumericArgument) degree).lexeme());
        } catch (NumberFormatException tooLarge) {
            throw new FormulaBuildException("poly() degree out of range, got: " + degree.render(), formula, null);
        }
        if (value <= 0) {
            throw new FormulaBuildException("poly() degree must be positive, got: " + value, formula, null);
        }
        return value;
    }

    private static Map<String, Object> parameters(FunctionCall call, Integer degree) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if ("poly".equals(call.name())) {
            if (degree != null) {
                parameters.put("degree", degree);
                parameters.put("orthogonal", !isRaw(call));
            }
            return parameters;
        }

        List<Argument> arguments = call.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            Argument argument = arguments.get(i);
            if (argument instanceof Argument.NamedArgument) {
                Argument.NamedArgument named = (Argument.NamedArgument) argument;
                parameters.put(named.key(), scalar(named.value()));
            } else if (!"log".equals(call.name())) {
                parameters.put("arg_" + i, scalar(argument));
            }
        }
        return parameters;
    }

    private static boolean isRaw(FunctionCall call) {
        for (Argument argument : call.arguments()) {
            if (argument instanceof Argument.NamedArgument) {
                Argument.NamedArgument named = (Argument.NamedArgument) argument;
                if ("raw".equals(named.key()) && named.value() instanceof Argument.BooleanArgument) {
                    return ((Argument.BooleanArgument) named.value()).value();
                }
            }
        }
        return false;
    }

    private static Object scalar(Argument argument) {
        if (argument instanceof Argument.NumericArgument) {
            Argument.NumericArgument number = (Argument.NumericArgument) argument;
            if (number.isInteger()) {
                try {
                    return Long.parseLong(number.lexeme());
                } catch (NumberFormatException tooLarge) {
                    return number.doubleValue();
                }
            }
            return number.doubleValue();
        }
        if (argument instanceof Argument.StringArgument) {
            return ((Argument.StringArgument) argument).value();
        }
        if (argument instanceof Argument.BooleanArgument) {
            return ((Argument.BooleanArgument) argument).value();
        }
        if (argument instanceof Argument.NullArgument) {
            return null;
        }
        return argument.render();
    }

    private void emit(Evaluated evaluated) {
        if (evaluated == null) {
            return;
        }
        for (String column : evaluated.columns) {
            registry.emit(evaluated.owner, column);
        }
    }

    // ---------------------------------------------------------------- random effects

    private void randomEffect(RandomEffect term) {
        randomEffects = true;
        CorrelationKind kind = term.correlation().kind();
        if (kind == CorrelationKind.UNCORRELATED) {
            uncorrelated = true;
        }

        Participants effects = new Participants();
        for (Term effect : term.effects()) {
            if (effect instanceof Interaction) {
                effects.addAll(interaction((Interaction) effect, VariableRole.RANDOM_EFFECT, Collections.emptySet()));
            } else {
                Evaluated evaluated = evaluate(effect, VariableRole.RANDOM_EFFECT);
                emit(evaluated);
                effects.add(evaluated);
            }
        }

        GroupExpression group = term.group();
        List<String> groupingNames = new ArrayList<>(group.groupingVariables());
        Map<String, Object> options = Collections.emptyMap();
        if (group instanceof GroupExpression.GrGroup) {
            GroupExpression.GrGroup gr = (GroupExpression.GrGroup) group;
            options = gr.options().asMap();
            if (gr.options().by() != null && !groupingNames.contains(gr.options().by())) {
                groupingNames.add(gr.options().by());
            }
        }

        List<VariableRecord> grouping = new ArrayList<>();
        for (String name : groupingNames) {
            for (VariableRecord effect : effects.variables) {
                if (effect.name.equals(name)) {
                    throw new FormulaBuildException(String.format(
                        "variable '%s' is both an effect and the grouping factor of %s", name, term.label()),
                        formula, name);
                }
            }
            VariableRecord record = registry.register(name, VariableRole.GROUPING_VARIABLE);
            registry.emit(record, name);
            grouping.add(record);
        }

        String label = group.label();
        String correlationId = term.correlation().id();
        boolean correlated = kind != CorrelationKind.UNCORRELATED;
        boolean withInteractions = !effects.interactions.isEmpty();
        List<String> effectNames = new ArrayList<>();
        effects.variables.forEach(record -> effectNames.add(record.name));

        RandomEffectInfo effectInfo = new RandomEffectInfo(RandomEffectInfo.Kind.EFFECT, label, kind,
            correlationId, correlated, term.hasIntercept(), List.of(), withInteractions, options);
        RandomEffectInfo groupingInfo = new RandomEffectInfo(RandomEffectInfo.Kind.GROUPING, label, kind,
            correlationId, correlated, term.hasIntercept(), effectNames, withInteractions, options);

        effects.variables.forEach(record -> record.addRandomEffect(effectInfo));
        grouping.forEach(record -> record.addRandomEffect(groupingInfo));
    }

    /**
     * Columns generated by one term and the variable receiving them.
     */
    private static final class Evaluated {
        final VariableRecord owner;
        final List<String> columns;
        final Collection<VariableRecord> variables;

        Evaluated(VariableRecord owner, List<String> columns, Collection<VariableRecord> variables) {
            this.owner = owner;
            this.columns = columns;
            this.variables = variables;
        }
    }

    private static final class Participants {
        final Set<VariableRecord> variables = new LinkedHashSet<>();
        final List<String> interactions = new ArrayList<>();

        void add(Evaluated evaluated) {
            if (evaluated != null) {
                variables.addAll(evaluated.variables);
            }
        }

        void addAll(Participants other) {
            variables.addAll(other.variables);
            interactions.addAll(other.interactions);
        }
    }
}
