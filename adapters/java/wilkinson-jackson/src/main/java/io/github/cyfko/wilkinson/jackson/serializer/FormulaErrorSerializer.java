package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.TokenKind;

import java.io.IOException;

/**
 * Writes the structured fields of pipeline failures so that a client can render its own
 * diagnostic.
 * <ul>
 *   <li>syntax: {@code {error: "syntax", message, reason, formula, position, found, expected, consumed}}</li>
 *   <li>build: {@code {error: "build", message, formula, variable}}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaErrorSerializer extends StdSerializer<RuntimeException> {

    public FormulaErrorSerializer() {
        super(RuntimeException.class);
    }

    @Override
    public void serialize(RuntimeException error, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (error instanceof FormulaSyntaxException) {
            FormulaSyntaxException syntax = (FormulaSyntaxException) error;
            gen.writeStringField("error", "syntax");
            gen.writeStringField("message", syntax.getMessage());
            gen.writeStringField("reason", syntax.getReason());
            gen.writeStringField("formula", syntax.getFormula());
            gen.writeNumberField("position", syntax.getPosition());
            if (syntax.getFound() != null) {
                gen.writeFieldName("found");
                provider.defaultSerializeValue(syntax.getFound(), gen);
            }
            gen.writeArrayFieldStart("expected");
            for (TokenKind kind : syntax.getExpected()) {
                gen.writeString(kind.label());
            }
            gen.writeEndArray();
            Json.writeStrings(gen, "consumed", syntax.getConsumedLexemes());
        } else if (error instanceof FormulaBuildException) {
            FormulaBuildException build = (FormulaBuildException) error;
            gen.writeStringField("error", "build");
            gen.writeStringField("message", build.getMessage());
            gen.writeStringField("formula", build.getFormula());
            gen.writeStringField("variable", build.getVariable());
        } else {
            gen.writeStringField("error", "internal");
            gen.writeStringField("message", error.getMessage());
        }
        gen.writeEndObject();
    }
}
