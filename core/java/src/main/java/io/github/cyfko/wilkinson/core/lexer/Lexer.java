package io.github.cyfko.wilkinson.core.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-pass tokenizer for formula text.
 * <p>
 * The lexer is total: it never throws for non-null input. Characters it cannot classify
 * become {@link TokenKind#UNKNOWN} tokens and lexing carries on, leaving the parser to turn
 * them into a syntax error at the right position.
 * </p>
 *
 * <h2>Matching rules</h2>
 * <ul>
 *   <li>Whitespace is skipped and never produces a token.</li>
 *   <li>Longest match first: {@code ||} before {@code |}, a whole digit run before {@code 1}/{@code 0}.</li>
 *   <li>A digit run alone is {@code One}, {@code Zero} or {@code Integer}; followed by {@code .}
 *       and another digit run it is a single {@code Number}.</li>
 *   <li>Identifiers ({@code [A-Za-z][A-Za-z0-9_.]*}) equal to a reserved word are tagged with the
 *       keyword kind.</li>
 *   <li>{@code "..."} is a string literal. An unterminated string is one {@code Unknown} token
 *       spanning the rest of the input.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Lexer.lex("y ~ x + (1 | g)");
 * // ColumnName(y) Tilde ColumnName(x) Plus FunctionStart One Pipe ColumnName(g) FunctionEnd
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private Lexer() {
        // utility class
    }

    /**
     * Tokenizes a formula.
     *
     * @param text the formula text
     * @return the ordered, unmodifiable token list (never contains {@link TokenKind#END_OF_INPUT})
     * @throws NullPointerException if {@code text} is null
     */
    public static List<Token> lex(String text) {
        if (text == null) {
            throw new NullPointerException("formula text is required");
        }

        List<Token> tokens = new ArrayList<>();
        final int length = text.length();
        int i = 0;

        while (i < length) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isDigit(c)) {
                i = readNumber(text, i, tokens);
                continue;
            }

            if (isIdentifierStart(c)) {
                int start = i;
                while (i < length && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                String word = text.substring(start, i);
                tokens.add(new Token(TokenKind.classifyWord(word), word, start));
                continue;
            }

            if (c == '"') {
                int close = text.indexOf('"', i + 1);
                if (close < 0) {
                    tokens.add(new Token(TokenKind.UNKNOWN, text.substring(i), i));
                    break;
                }
                tokens.add(new Token(TokenKind.STRING_LITERAL, text.substring(i, close + 1), i));
                i = close + 1;
                continue;
            }

            if (c == '|' && i + 1 < length && text.charAt(i + 1) == '|') {
                tokens.add(new Token(TokenKind.DOUBLE_PIPE, "||", i));
                i += 2;
                continue;
            }

            TokenKind operator = operatorKind(c);
            tokens.add(new Token(operator, String.valueOf(c), i));
            i++;
        }

        return Collections.unmodifiableList(tokens);
    }

    private static int readNumber(String text, int start, List<Token> tokens) {
        final int length = text.length();
        int i = start;
        while (i < length && isDigit(text.charAt(i))) {
            i++;
        }

        if (i + 1 < length && text.charAt(i) == '.' && isDigit(text.charAt(i + 1))) {
            i++;
            while (i < length && isDigit(text.charAt(i))) {
                i++;
            }
            tokens.add(new Token(TokenKind.NUMBER, text.substring(start, i), start));
            return i;
        }

        String digits = text.substring(start, i);
        TokenKind kind;
        if ("1".equals(digits)) {
            kind = TokenKind.ONE;
        } else if ("0".equals(digits)) {
            kind = TokenKind.ZERO;
        } else {
            kind = TokenKind.INTEGER;
        }
        tokens.add(new Token(kind, digits, start));
        return i;
    }

    private static TokenKind operatorKind(char c) {
        switch (c) {
            case '~': return TokenKind.TILDE;
            case '+': return TokenKind.PLUS;
            case '-': return TokenKind.MINUS;
            case '*': return TokenKind.STAR;
            case ':': return TokenKind.COLON;
            case '|': return TokenKind.PIPE;
            case '(': return TokenKind.LPAREN;
            case ')': return TokenKind.RPAREN;
            case ',': return TokenKind.COMMA;
            case '^': return TokenKind.CARET;
            case '=': return TokenKind.EQUAL;
            case '/': return TokenKind.SLASH;
            default: return TokenKind.UNKNOWN;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '_' || c == '.';
    }
}
