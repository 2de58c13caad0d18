package io.github.cyfko.wilkinson.core.lexer;

import java.util.Objects;

/**
 * Immutable lexical token: its kind, the exact source substring and its 0-based offset.
 *
 * @param kind     token kind
 * @param lexeme   exact source text of the token
 * @param position offset of the first character of the lexeme in the formula
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String lexeme, int position) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative, got: " + position);
        }
    }

    /**
     * @return the offset just past the last character of the lexeme
     */
    public int end() {
        return position + lexeme.length();
    }

    @Override
    public String toString() {
        return kind.label() + "('" + lexeme + "')@" + position;
    }
}
