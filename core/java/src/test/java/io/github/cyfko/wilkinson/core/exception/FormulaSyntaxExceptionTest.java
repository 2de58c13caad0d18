package io.github.cyfko.wilkinson.core.exception;

import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.lexer.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaSyntaxExceptionTest {

    @Test
    @DisplayName("Message names the reason, position, found token and expected kinds")
    void messageWithContext() {
        Token found = new Token(TokenKind.RPAREN, ")", 6);
        FormulaSyntaxException e = new FormulaSyntaxException("Unexpected token", "y ~ (x))",
            EnumSet.of(TokenKind.PLUS), found, List.of("y", "~", "(", "x", ")"));

        assertEquals(6, e.getPosition());
        assertSame(found, e.getFound());
        assertEquals("Unexpected token", e.getReason());
        assertEquals("y ~ (x))", e.getFormula());
        assertEquals(List.of("y", "~", "(", "x", ")"), e.getConsumedLexemes());
        assertTrue(e.getMessage().startsWith("Unexpected token at position 6: found ')'"));
        assertTrue(e.getMessage().contains("Plus"));
    }

    @Test
    void endOfInput() {
        Token end = new Token(TokenKind.END_OF_INPUT, "", 7);
        FormulaSyntaxException e = new FormulaSyntaxException("Unexpected token", "y ~ x +",
            EnumSet.of(TokenKind.COLUMN_NAME), end, List.of("y", "~", "x", "+"));

        assertTrue(e.getMessage().contains("found end of input"));
    }

    @Test
    @DisplayName("Limit violations carry no token context")
    void messageOnly() {
        FormulaSyntaxException e = new FormulaSyntaxException("Formula cannot be null or empty");

        assertEquals(-1, e.getPosition());
        assertNull(e.getFound());
        assertTrue(e.getExpected().isEmpty());
        assertTrue(e.getConsumedLexemes().isEmpty());
    }
}
