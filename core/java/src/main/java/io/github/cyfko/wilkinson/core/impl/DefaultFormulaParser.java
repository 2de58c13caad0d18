package io.github.cyfko.wilkinson.core.impl;

import io.github.cyfko.wilkinson.core.api.FormulaParser;
import io.github.cyfko.wilkinson.core.ast.FormulaProgram;
import io.github.cyfko.wilkinson.core.cache.BoundedLRUCache;
import io.github.cyfko.wilkinson.core.config.CachePolicy;
import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.Lexer;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;
import io.github.cyfko.wilkinson.core.parsing.FormulaGrammar;
import io.github.cyfko.wilkinson.core.semantic.MetadataBuilder;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: lexer, grammar and metadata builder behind policy checks and an
 * optional result cache.
 *
 * <h2>Limits</h2>
 * <p>
 * The {@link FormulaPolicy} bounds the formula length (checked before lexing) and the nesting
 * depth (checked while parsing), and supplies the family used when the formula assigns none.
 * </p>
 *
 * <h2>Caching</h2>
 * <ul>
 *   <li><strong>Cache Key</strong>: the formula text, as given</li>
 *   <li><strong>Cache Value</strong>: the immutable {@link FormulaMetaData}</li>
 *   <li><strong>Failures</strong>: never cached, every call re-raises them</li>
 *   <li><strong>Configurable</strong>: enable, disable or size via {@link CachePolicy}</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new DefaultFormulaParser();
 * FormulaMetaData meta = parser.parse("y ~ x + (1 | g)");
 *
 * FormulaParser strict = new DefaultFormulaParser(FormulaPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * <p>Instances are thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DefaultFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(DefaultFormulaParser.class.getName());

    private final FormulaPolicy formulaPolicy;
    private final CachePolicy cachePolicy;
    private final MetadataBuilder metadataBuilder;
    protected final BoundedLRUCache<String, FormulaMetaData> cache;

    /**
     * Parser with {@link FormulaPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public DefaultFormulaParser() {
        this(FormulaPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param formulaPolicy limits and default family
     * @throws IllegalArgumentException if formulaPolicy is null
     */
    public DefaultFormulaParser(FormulaPolicy formulaPolicy) {
        this(formulaPolicy, CachePolicy.defaults());
    }

    /**
     * @param formulaPolicy limits and default family
     * @param cachePolicy   result cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public DefaultFormulaParser(FormulaPolicy formulaPolicy, CachePolicy cachePolicy) {
        this(formulaPolicy, cachePolicy, new MetadataBuilder());
    }

    DefaultFormulaParser(FormulaPolicy formulaPolicy, CachePolicy cachePolicy, MetadataBuilder metadataBuilder) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }
        if (metadataBuilder == null) {
            throw new IllegalArgumentException("Metadata builder is required");
        }

        this.formulaPolicy = formulaPolicy;
        this.cachePolicy = cachePolicy;
        this.metadataBuilder = metadataBuilder;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    /**
     * Clears the result cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return {@code enabled}, plus {@code size}, {@code maxSize}, {@code hits} and {@code misses}
     *         when the cache is enabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize(),
            "hits", cache.hits(),
            "misses", cache.misses()
        );
    }

    @Override
    public FormulaMetaData parse(String formula) throws FormulaSyntaxException, FormulaBuildException {
        checkInput(formula);
        if (cache != null) {
            return cache.computeIfAbsent(formula, this::runPipeline);
        }
        return runPipeline(formula);
    }

    @Override
    public FormulaProgram parseProgram(String formula) throws FormulaSyntaxException {
        checkInput(formula);
        return FormulaGrammar.parse(formula, Lexer.lex(formula), formulaPolicy);
    }

    @Override
    public List<Token> lex(String formula) {
        return Lexer.lex(formula);
    }

    private FormulaMetaData runPipeline(String formula) {
        long start = System.nanoTime();
        try {
            FormulaProgram program = FormulaGrammar.parse(formula, Lexer.lex(formula), formulaPolicy);
            FormulaMetaData metaData = metadataBuilder.build(program, formula, formulaPolicy);
            long micros = (System.nanoTime() - start) / 1_000;
            log.fine(() -> String.format("Parsed '%s' in %d us: %d variables, %d generated columns",
                formula, micros, metaData.variables().size(), metaData.allGeneratedColumns().size()));
            return metaData;
        } catch (FormulaSyntaxException | FormulaBuildException e) {
            log.fine(() -> String.format("Rejected formula '%s': %s", formula, e.getMessage()));
            throw e;
        }
    }

    private void checkInput(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaSyntaxException("Formula cannot be null or empty");
        }
        if (formula.length() > formulaPolicy.maxFormulaLength()) {
            throw new FormulaSyntaxException(String.format(
                "Formula too long (%d characters, max: %d). Policy applied: %s",
                formula.length(), formulaPolicy.maxFormulaLength(), formulaPolicy.policyName()));
        }
    }
}
