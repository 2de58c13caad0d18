package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.lexer.Token;

import java.io.IOException;

/**
 * Writes a {@link Token} as {@code {"token": "<kind label>", "lexeme": "..."}}.
 *
 * @since 1.0.0
 */
public class TokenSerializer extends StdSerializer<Token> {

    public TokenSerializer() {
        super(Token.class);
    }

    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("token", token.kind().label());
        gen.writeStringField("lexeme", token.lexeme());
        gen.writeEndObject();
    }
}
