package io.github.cyfko.wilkinson.core.exception;

import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.lexer.TokenKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exception thrown when a formula cannot be parsed.
 * <p>
 * Parsing stops at the first violation. The exception carries everything a caller needs
 * to render a diagnostic without re-parsing: the token kinds that would have been accepted,
 * the offending token, its position, the lexemes consumed before it and the original text.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("y ~ x +");
 * // → "Unexpected token at position 7: found end of input, expected one of [ColumnName, One, Zero, ...]"
 *
 * parser.parse("y ~ 1 - 1");
 * // → "contradictory intercept specification at position 8: found '1'"
 *
 * parser.parse("y ~ x $ z");
 * // → "Unrecognized character at position 6: found '$'"
 * }</pre>
 *
 * <p>
 * Input rejected before tokenization (null, blank, or over a {@code FormulaPolicy} limit) is
 * reported with the same type but without token context: {@link #getFound()} is {@code null}
 * and {@link #getPosition()} is {@code -1}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaSyntaxException extends RuntimeException {

    private final String reason;
    private final String formula;
    private final Set<TokenKind> expected;
    private final Token found;
    private final List<String> consumedLexemes;

    /**
     * Constructs an exception without token context.
     *
     * @param message the detail message
     */
    public FormulaSyntaxException(String message) {
        super(message);
        this.reason = message;
        this.formula = null;
        this.expected = Collections.emptySet();
        this.found = null;
        this.consumedLexemes = Collections.emptyList();
    }

    /**
     * Constructs an exception for an offending token.
     *
     * @param reason          short description of the violation
     * @param formula         original formula text
     * @param expected        token kinds that would have been accepted (may be empty)
     * @param found           offending token
     * @param consumedLexemes lexemes successfully consumed before {@code found}
     */
    public FormulaSyntaxException(String reason, String formula, Set<TokenKind> expected,
                                  Token found, List<String> consumedLexemes) {
        super(describe(reason, expected, found));
        this.reason = reason;
        this.formula = formula;
        this.expected = expected.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.found = found;
        this.consumedLexemes = List.copyOf(consumedLexemes);
    }

    private static String describe(String reason, Set<TokenKind> expected, Token found) {
        StringBuilder sb = new StringBuilder(reason);
        sb.append(" at position ").append(found.position()).append(": found ");
        if (found.kind() == TokenKind.END_OF_INPUT) {
            sb.append("end of input");
        } else {
            sb.append('\'').append(found.lexeme()).append('\'');
        }
        if (!expected.isEmpty()) {
            sb.append(", expected one of ")
                .append(EnumSet.copyOf(expected).stream().map(TokenKind::label)
                    .collect(Collectors.joining(", ", "[", "]")));
        }
        return sb.toString();
    }

    /**
     * @return short description of the violation, without position information
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return the original formula text, or {@code null} when rejected before tokenization
     */
    public String getFormula() {
        return formula;
    }

    /**
     * @return token kinds that would have been accepted at the failure point
     */
    public Set<TokenKind> getExpected() {
        return expected;
    }

    /**
     * @return the offending token, or {@code null} when rejected before tokenization
     */
    public Token getFound() {
        return found;
    }

    /**
     * @return offset of the offending token, or {@code -1}
     */
    public int getPosition() {
        return found == null ? -1 : found.position();
    }

    /**
     * @return lexemes consumed before the failure, in order
     */
    public List<String> getConsumedLexemes() {
        return consumedLexemes;
    }
}
