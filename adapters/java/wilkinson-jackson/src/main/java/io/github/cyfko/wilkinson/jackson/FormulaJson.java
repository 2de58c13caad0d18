package io.github.cyfko.wilkinson.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.wilkinson.core.api.FormulaParser;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.impl.DefaultFormulaParser;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON entry points of the formula pipeline.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaJson json = new FormulaJson();
 * ObjectNode meta = json.parseFormula("y ~ x + (1 | g)");
 * meta.get("all_generated_columns");   // ["y","intercept","x","g"]
 *
 * ArrayNode tokens = json.lexFormula("y ~ x");
 * // [{"token":"ColumnName","lexeme":"y"},{"token":"Tilde","lexeme":"~"},{"token":"ColumnName","lexeme":"x"}]
 *
 * try {
 *     json.parseFormula("y ~ 1 - 1");
 * } catch (FormulaSyntaxException e) {
 *     ObjectNode error = json.describeError(e); // reason, position, found, expected, consumed
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaJson {

    private final FormulaParser parser;
    private final ObjectMapper mapper;

    public FormulaJson() {
        this(new DefaultFormulaParser());
    }

    /**
     * @param parser the parser to delegate to
     */
    public FormulaJson(FormulaParser parser) {
        this(parser, new ObjectMapper());
    }

    /**
     * @param parser the parser to delegate to
     * @param mapper the mapper to use; the {@link WilkinsonJacksonModule} is registered on it
     */
    public FormulaJson(FormulaParser parser, ObjectMapper mapper) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.mapper = Objects.requireNonNull(mapper, "mapper").registerModule(new WilkinsonJacksonModule());
    }

    /**
     * @param formula the formula text
     * @return the metadata as a JSON object
     * @throws FormulaSyntaxException if the formula is malformed
     * @throws FormulaBuildException  if the formula is semantically inconsistent
     */
    public ObjectNode parseFormula(String formula) {
        return mapper.valueToTree(parser.parse(formula));
    }

    /**
     * @param formula the formula text
     * @return the tokens as {@code {token, lexeme}} objects
     */
    public ArrayNode lexFormula(String formula) {
        return mapper.valueToTree(parser.lex(formula));
    }

    /**
     * @param error a {@link FormulaSyntaxException} or {@link FormulaBuildException}
     * @return the structured fields of the error
     */
    public ObjectNode describeError(RuntimeException error) {
        return mapper.valueToTree(error);
    }

    /**
     * Serializes any value of the formula model.
     *
     * @param value metadata, tokens or an error
     * @return indented JSON text
     * @throws UncheckedIOException if serialization fails
     */
    public String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
