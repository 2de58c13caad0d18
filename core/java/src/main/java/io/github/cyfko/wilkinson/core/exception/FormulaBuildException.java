package io.github.cyfko.wilkinson.core.exception;

/**
 * Exception thrown when a syntactically valid formula is semantically inconsistent.
 * <p>
 * Raised by the metadata builder, never resolved silently. Typical causes:
 * </p>
 * <ul>
 *   <li>the response variable used again on the right-hand side</li>
 *   <li>a variable used as both effect and grouping factor of one random-effect term</li>
 *   <li>two variables generating the same column name</li>
 *   <li>an explicit intercept combined with an ordinal family</li>
 *   <li>an unknown family or a repeated assignment</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaBuildException extends RuntimeException {

    private final String formula;
    private final String variable;

    /**
     * @param message  the detail message
     * @param formula  the formula being built
     * @param variable the variable at fault, or {@code null} when not tied to one
     */
    public FormulaBuildException(String message, String formula, String variable) {
        super(message);
        this.formula = formula;
        this.variable = variable;
    }

    public String getFormula() {
        return formula;
    }

    /**
     * @return the variable at fault, or {@code null}
     */
    public String getVariable() {
        return variable;
    }
}
