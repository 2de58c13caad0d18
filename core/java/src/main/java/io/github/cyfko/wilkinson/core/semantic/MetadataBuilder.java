package io.github.cyfko.wilkinson.core.semantic;

import io.github.cyfko.wilkinson.core.ast.Argument;
import io.github.cyfko.wilkinson.core.ast.ColumnName;
import io.github.cyfko.wilkinson.core.ast.Formula;
import io.github.cyfko.wilkinson.core.ast.FormulaProgram;
import io.github.cyfko.wilkinson.core.ast.FunctionCall;
import io.github.cyfko.wilkinson.core.ast.InterceptSpec;
import io.github.cyfko.wilkinson.core.ast.ProgramEntry;
import io.github.cyfko.wilkinson.core.ast.Term;
import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.model.AuxiliaryParameter;
import io.github.cyfko.wilkinson.core.model.Family;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic pass turning a parsed {@link FormulaProgram} into {@link FormulaMetaData}.
 * <p>
 * One walk over the main formula, left to right, with a registry scoped to the call:
 * </p>
 * <ol>
 *   <li>responses get ids {@code 1..k} and role {@code Response};</li>
 *   <li>every other variable gets the next id on first appearance, with the role of that
 *       appearance ({@code Identity}, {@code FixedEffect}, {@code RandomEffect} or
 *       {@code GroupingVariable}); later appearances only add roles and structure;</li>
 *   <li>columns are recorded once, in emission order, giving the formula-order view, and on
 *       their variable, giving the id-order view;</li>
 *   <li>{@code has_intercept} comes from the validated intercept marks, falling back to what the
 *       family supports, and {@code "intercept"} is inserted right after the responses in
 *       id order and at its textual position in formula order.</li>
 * </ol>
 * <p>
 * Auxiliary parameter formulas ({@code sigma ~ ...}) are built with registries of their own.
 * Instances hold no state and may be shared between threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MetadataBuilder {

    private static final String FAMILY_KEY = "family";

    /**
     * Builds the metadata of a parsed program.
     *
     * @param program the parsed program
     * @param formula the formula text the program was parsed from
     * @param policy  supplies the family reported when the program assigns none and the
     *                column limit of each formula
     * @return the metadata
     * @throws FormulaBuildException if the program is semantically inconsistent or generates
     *                               more columns than the policy allows
     */
    public FormulaMetaData build(FormulaProgram program, String formula, FormulaPolicy policy) {
        Formula main = program.main();
        List<String> responses = main.response() == null ? List.of() : main.response().names();
        Family family = resolveFamily(program.entries(), formula, policy.defaultFamily());

        VariableRegistry registry = new VariableRegistry(formula, new LinkedHashSet<>(responses), policy);
        responses.forEach(registry::response);

        TermWalker walker = new TermWalker(registry, main.droppedTerms(), formula);
        walker.walk(main.rhs());

        boolean hasIntercept = resolveIntercept(main.intercept(), family, formula);
        if (hasIntercept && registry.generates(VariableRegistry.INTERCEPT)) {
            String owner = registry.ownerOf(VariableRegistry.INTERCEPT);
            throw new FormulaBuildException(
                "variable '" + owner + "' generates a column named 'intercept', which clashes with the model intercept",
                formula, owner);
        }

        List<AuxiliaryParameter> auxiliary = auxiliaryParameters(program.entries(), responses, formula, policy);

        Set<String> names = new LinkedHashSet<>(registry.names());
        for (AuxiliaryParameter parameter : auxiliary) {
            names.addAll(parameter.columnNames());
        }
        List<String> columnNames = new ArrayList<>(names);

        Map<Integer, String> formulaOrder = new LinkedHashMap<>();
        List<String> textual = registry.columnsInFormulaOrder(hasIntercept, responses.size());
        for (int i = 0; i < textual.size(); i++) {
            formulaOrder.put(i + 1, textual.get(i));
        }

        return new FormulaMetaData(
            formula,
            hasIntercept,
            family,
            walker.sawRandomEffects(),
            walker.sawUncorrelatedTerm(),
            responses.size(),
            columnNames,
            registry.variables(),
            registry.columnsInIdOrder(hasIntercept, responses.size()),
            formulaOrder,
            auxiliary
        );
    }

    private static boolean resolveIntercept(InterceptSpec spec, Family family, String formula) {
        switch (spec) {
            case PRESENT:
                if (!family.supportsIntercept()) {
                    throw new FormulaBuildException(
                        "family '" + family.familyName() + "' does not support an explicit intercept", formula, null);
                }
                return true;
            case ABSENT:
                return false;
            default:
                return family.supportsIntercept();
        }
    }

    private static Family resolveFamily(List<ProgramEntry> entries, String formula, Family defaultFamily) {
        Family family = null;
        for (ProgramEntry entry : entries) {
            if (!(entry instanceof ProgramEntry.Assignment)) {
                continue;
            }
            ProgramEntry.Assignment assignment = (ProgramEntry.Assignment) entry;
            if (!FAMILY_KEY.equals(assignment.name())) {
                throw new FormulaBuildException("unsupported assignment '" + assignment.name() + "'", formula, null);
            }
            if (family != null) {
                throw new FormulaBuildException("family is assigned more than once", formula, null);
            }
            String name = familyName(assignment.value());
            family = Family.fromName(name).orElseThrow(() ->
                new FormulaBuildException("unknown family '" + name + "'", formula, null));
        }
        return family == null ? defaultFamily : family;
    }

    private static String familyName(Argument value) {
        if (value instanceof Argument.StringArgument) {
            return ((Argument.StringArgument) value).value();
        }
        if (value instanceof Argument.TermArgument) {
            Term term = ((Argument.TermArgument) value).term();
            if (term instanceof ColumnName) {
                return ((ColumnName) term).name();
            }
            if (term instanceof FunctionCall) {
                return ((FunctionCall) term).name();
            }
        }
        return value.render();
    }

    private static List<AuxiliaryParameter> auxiliaryParameters(List<ProgramEntry> entries, List<String> responses,
                                                                String formula, FormulaPolicy policy) {
        List<AuxiliaryParameter> parameters = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (ProgramEntry entry : entries) {
            if (!(entry instanceof ProgramEntry.ParameterFormula)) {
                continue;
            }
            ProgramEntry.ParameterFormula parameter = (ProgramEntry.ParameterFormula) entry;
            String name = parameter.name();
            if (responses.contains(name)) {
                throw new FormulaBuildException(
                    "auxiliary parameter '" + name + "' has the name of a response variable", formula, name);
            }
            if (!seen.add(name)) {
                throw new FormulaBuildException("auxiliary parameter '" + name + "' is defined twice", formula, name);
            }

            Formula sub = parameter.formula();
            VariableRegistry registry = new VariableRegistry(formula, Collections.emptySet(), policy);
            new TermWalker(registry, sub.droppedTerms(), formula).walk(sub.rhs());
            boolean hasIntercept = sub.intercept() != InterceptSpec.ABSENT;
            if (hasIntercept && registry.generates(VariableRegistry.INTERCEPT)) {
                String owner = registry.ownerOf(VariableRegistry.INTERCEPT);
                throw new FormulaBuildException(
                    "variable '" + owner + "' generates a column named 'intercept' in the formula of '" + name + "'",
                    formula, owner);
            }
            parameters.add(new AuxiliaryParameter(name, hasIntercept, registry.names(),
                registry.columnsInFormulaOrder(hasIntercept, 0)));
        }
        return parameters;
    }
}
