package io.github.cyfko.wilkinson.core;

import io.github.cyfko.wilkinson.core.api.FormulaParser;
import io.github.cyfko.wilkinson.core.config.CachePolicy;
import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.impl.DefaultFormulaParser;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;

import java.util.List;

/**
 * Static entry points of the formula pipeline.
 * <p>
 * Backed by an uncached {@link DefaultFormulaParser} with {@link FormulaPolicy#defaults()}, so
 * calls keep no state between them. Build a {@link DefaultFormulaParser} directly for custom
 * limits or a result cache.
 * </p>
 *
 * <pre>{@code
 * FormulaMetaData meta = Formulas.parseFormula("mpg ~ wt * hp + poly(disp, 4) - 1");
 * List<Token> tokens = Formulas.lexFormula("y ~ x");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Formulas {

    private static final FormulaParser PARSER = new DefaultFormulaParser(FormulaPolicy.defaults(), CachePolicy.none());

    private Formulas() {
        // utility class
    }

    /**
     * @param formula the formula text
     * @return the metadata of the formula
     * @throws FormulaSyntaxException if the formula is malformed
     * @throws FormulaBuildException  if the formula is semantically inconsistent
     */
    public static FormulaMetaData parseFormula(String formula) {
        return PARSER.parse(formula);
    }

    /**
     * @param formula the formula text
     * @return the raw token stream, {@code Unknown} tokens included
     */
    public static List<Token> lexFormula(String formula) {
        return PARSER.lex(formula);
    }
}
