package io.github.cyfko.wilkinson.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Variable-centric description of a parsed formula.
 * <p>
 * Two orderings of the generated columns are exposed. {@link #allGeneratedColumns()} follows
 * variable ids with {@code "intercept"} at index 1 when present;
 * {@link #allGeneratedColumnsFormulaOrder()} maps 1-based textual positions to the same names.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * FormulaMetaData meta = Formulas.parseFormula("y ~ x + z");
 * meta.allGeneratedColumns();               // [y, intercept, x, z]
 * meta.allGeneratedColumnsFormulaOrder();   // {1=y, 2=intercept, 3=x, 4=z}
 * meta.variable("x").get().role();          // IDENTITY
 * }</pre>
 *
 * @param formula                           the formula text as given
 * @param hasIntercept                      whether the model has a population-level intercept
 * @param family                            response family, never null
 * @param isRandomEffectsModel              whether any group-level term is present
 * @param hasUncorrelatedSlopesAndIntercepts whether any group-level term is uncorrelated
 * @param responseVariableCount             number of response variables
 * @param columnNames                       raw input columns referenced, by id then auxiliary order
 * @param variables                         variables ordered by id
 * @param allGeneratedColumns               generated columns in id order
 * @param allGeneratedColumnsFormulaOrder   1-based formula position to column name
 * @param auxiliaryParameters               distributional parameter formulas
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaMetaData(
    String formula,
    boolean hasIntercept,
    Family family,
    boolean isRandomEffectsModel,
    boolean hasUncorrelatedSlopesAndIntercepts,
    int responseVariableCount,
    List<String> columnNames,
    List<Variable> variables,
    List<String> allGeneratedColumns,
    Map<Integer, String> allGeneratedColumnsFormulaOrder,
    List<AuxiliaryParameter> auxiliaryParameters
) {

    public FormulaMetaData {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(family, "family");
        columnNames = List.copyOf(columnNames);
        variables = List.copyOf(variables);
        allGeneratedColumns = List.copyOf(allGeneratedColumns);
        allGeneratedColumnsFormulaOrder = Collections.unmodifiableMap(new TreeMap<>(allGeneratedColumnsFormulaOrder));
        auxiliaryParameters = List.copyOf(auxiliaryParameters);
    }

    /**
     * Finds a variable by name.
     *
     * @param name the variable name
     * @return the variable, or empty if the formula does not reference it
     */
    public Optional<Variable> variable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    /**
     * @return the variables with role {@link VariableRole#RESPONSE}, in id order
     */
    public List<Variable> responses() {
        return variables.subList(0, responseVariableCount);
    }
}
