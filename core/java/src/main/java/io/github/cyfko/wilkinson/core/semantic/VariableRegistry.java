package io.github.cyfko.wilkinson.core.semantic;

import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;
import io.github.cyfko.wilkinson.core.model.Transformation;
import io.github.cyfko.wilkinson.core.model.Variable;
import io.github.cyfko.wilkinson.core.model.VariableRole;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered variable registry and column emission log of one formula.
 * <p>
 * Ids are handed out in registration order. Every generated column goes through
 * {@link #emit(VariableRecord, String)}, which appends it both to its variable (id order view)
 * and to the emission log (formula order view); the two views therefore always hold the
 * same set of names. The log is capped at {@link FormulaPolicy#maxGeneratedColumns()} columns.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class VariableRegistry {

    static final String INTERCEPT = "intercept";

    private final String formula;
    private final Set<String> responseNames;
    private final FormulaPolicy policy;
    private final Map<String, VariableRecord> records = new LinkedHashMap<>();
    private final Map<String, String> columnOwners = new HashMap<>();
    private final List<String> emissions = new ArrayList<>();
    private int interceptSlot = -1;
    private int nextId = 1;

    /**
     * @param formula       formula text, for error reports
     * @param responseNames names that may not appear on the right-hand side
     * @param policy        supplies the column limit
     */
    VariableRegistry(String formula, Set<String> responseNames, FormulaPolicy policy) {
        this.formula = formula;
        this.responseNames = responseNames;
        this.policy = policy;
    }

    /**
     * Rejects a single term generating more columns than a formula may hold, before any of
     * them is built.
     *
     * @throws FormulaBuildException naming {@code variable} if {@code count} exceeds the limit
     */
    void checkColumnCount(long count, String variable) {
        if (count > policy.maxGeneratedColumns()) {
            throw tooManyColumns(variable);
        }
    }

    private FormulaBuildException tooManyColumns(String variable) {
        return new FormulaBuildException(String.format(
            "Formula generates too many columns (more than %d). Policy applied: %s",
            policy.maxGeneratedColumns(), policy.policyName()), formula, variable);
    }

    VariableRecord response(String name) {
        if (records.containsKey(name)) {
            throw new FormulaBuildException("response variable '" + name + "' is listed twice", formula, name);
        }
        VariableRecord record = new VariableRecord(nextId++, name);
        record.addRole(VariableRole.RESPONSE);
        records.put(name, record);
        emit(record, name);
        return record;
    }

    /**
     * Returns the record of {@code name}, registering it with the next id on first use, and
     * adds {@code role} to its roles.
     *
     * @throws FormulaBuildException if {@code name} is a response
     */
    VariableRecord register(String name, VariableRole role) {
        if (responseNames.contains(name)) {
            throw new FormulaBuildException(
                "response variable '" + name + "' cannot appear on the right-hand side", formula, name);
        }
        VariableRecord record = records.computeIfAbsent(name, n -> new VariableRecord(nextId++, n));
        record.addRole(role);
        return record;
    }

    /**
     * Attributes a generated column to a variable. Re-emitting a column of the same variable is
     * a no-op.
     *
     * @throws FormulaBuildException if another variable already generated the column, or the
     *                               column limit is reached
     */
    void emit(VariableRecord owner, String column) {
        String previous = columnOwners.get(column);
        if (previous == null) {
            if (emissions.size() >= policy.maxGeneratedColumns()) {
                throw tooManyColumns(owner.name);
            }
            columnOwners.put(column, owner.name);
            owner.columns.add(column);
            emissions.add(column);
        } else if (!previous.equals(owner.name)) {
            throw new FormulaBuildException(String.format(
                "column '%s' is generated by both '%s' and '%s'", column, previous, owner.name), formula, owner.name);
        }
    }

    /**
     * Records the textual position of an explicit intercept. Only the first one counts.
     */
    void markIntercept() {
        if (interceptSlot < 0) {
            interceptSlot = emissions.size();
        }
    }

    boolean generates(String column) {
        return columnOwners.containsKey(column);
    }

    String ownerOf(String column) {
        return columnOwners.get(column);
    }

    /**
     * @return generated columns by variable id, with {@code intercept} inserted at
     *         {@code interceptIndex} when requested
     */
    List<String> columnsInIdOrder(boolean intercept, int interceptIndex) {
        List<String> columns = new ArrayList<>();
        for (VariableRecord record : records.values()) {
            columns.addAll(record.columns);
        }
        if (intercept) {
            columns.add(Math.min(interceptIndex, columns.size()), INTERCEPT);
        }
        return columns;
    }

    /**
     * @return generated columns in textual order; the intercept sits where {@code 1} was
     *         written, or at {@code implicitSlot} when it was not
     */
    List<String> columnsInFormulaOrder(boolean intercept, int implicitSlot) {
        List<String> columns = new ArrayList<>(emissions);
        if (intercept) {
            int slot = interceptSlot >= 0 ? interceptSlot : implicitSlot;
            columns.add(Math.min(slot, columns.size()), INTERCEPT);
        }
        return columns;
    }

    List<String> names() {
        return new ArrayList<>(records.keySet());
    }

    List<Variable> variables() {
        List<Variable> variables = new ArrayList<>(records.size());
        for (VariableRecord record : records.values()) {
            variables.add(record.toVariable());
        }
        return variables;
    }

    /**
     * Mutable per-variable accumulator.
     */
    static final class VariableRecord {
        final int id;
        final String name;
        private final Set<VariableRole> roles = new LinkedHashSet<>();
        private final List<String> columns = new ArrayList<>();
        private final Set<Transformation> transformations = new LinkedHashSet<>();
        private final Set<String> interactions = new LinkedHashSet<>();
        private final Set<RandomEffectInfo> randomEffects = new LinkedHashSet<>();

        private VariableRecord(int id, String name) {
            this.id = id;
            this.name = name;
        }

        void addRole(VariableRole role) {
            roles.add(role);
        }

        void addTransformation(Transformation transformation) {
            transformations.add(transformation);
        }

        void addInteraction(String label) {
            interactions.add(label);
        }

        void addRandomEffect(RandomEffectInfo info) {
            randomEffects.add(info);
        }

        Variable toVariable() {
            return new Variable(id, name, roles.iterator().next(), new ArrayList<>(roles), columns,
                new ArrayList<>(transformations), new ArrayList<>(interactions), new ArrayList<>(randomEffects));
        }
    }
}
