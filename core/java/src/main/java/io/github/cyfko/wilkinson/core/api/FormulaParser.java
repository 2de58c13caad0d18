package io.github.cyfko.wilkinson.core.api;

import io.github.cyfko.wilkinson.core.ast.FormulaProgram;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;

import java.util.List;

/**
 * Parses statistical model formulas written in extended Wilkinson notation.
 * <p>
 * The pipeline is lexer, recursive-descent parser, then metadata builder. Each stage is a pure
 * function of its input; the first error aborts the pipeline and no partial result is returned.
 * </p>
 *
 * <h2>Supported notation</h2>
 * <pre>
 * y ~ x + z                       main effects (Identity variables)
 * y ~ wt * hp                     main effects plus interaction
 * y ~ a:b                         interaction only
 * y ~ (a + b + c)^2               all interactions up to order 2
 * y ~ poly(x, 3) + log(z)         transformations
 * y ~ 0 + x      y ~ x - 1        intercept removed
 * y ~ x + (1 + x | subject)       correlated random intercept and slope
 * y ~ x + (x || subject)          uncorrelated random effects
 * y ~ x + (1 |p| subject)         cross-parameter correlation id
 * y ~ (1 | gr(g, cor = FALSE, by = v))   grouping options
 * y ~ (1 | mm(g1, g2))            multi-membership grouping
 * y ~ (1 | school/class)          nested grouping
 * mvbind(y1, y2) ~ x              multivariate response
 * y ~ x, sigma ~ z, family = student     auxiliary parameters and family
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaParser parser = new DefaultFormulaParser();
 * FormulaMetaData meta = parser.parse("y ~ poly(disp, 4) + (1 | cyl)");
 * meta.allGeneratedColumns(); // [y, intercept, disp_poly_1, ..., disp_poly_4, cyl]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Runs the full pipeline on a formula.
     *
     * @param formula the formula text
     * @return the variable-centric metadata of the formula
     * @throws FormulaSyntaxException if the formula is null, blank, over a policy limit or malformed
     * @throws FormulaBuildException  if the formula is well formed but semantically inconsistent
     */
    FormulaMetaData parse(String formula) throws FormulaSyntaxException, FormulaBuildException;

    /**
     * Runs the lexer and the parser only.
     *
     * @param formula the formula text
     * @return the syntax tree of the formula
     * @throws FormulaSyntaxException if the formula is null, blank, over a policy limit or malformed
     */
    FormulaProgram parseProgram(String formula) throws FormulaSyntaxException;

    /**
     * Tokenizes a formula for inspection. Never fails on non-null input: unrecognized characters
     * come back as {@code Unknown} tokens.
     *
     * @param formula the formula text
     * @return the tokens in order
     */
    List<Token> lex(String formula);
}
