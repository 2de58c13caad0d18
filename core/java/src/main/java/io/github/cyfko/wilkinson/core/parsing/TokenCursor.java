package io.github.cyfko.wilkinson.core.parsing;

import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.lexer.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pull-based view over a token list with one token of lookahead.
 * <p>
 * Reading past the last token yields a synthesized {@link TokenKind#END_OF_INPUT} token
 * positioned at the end of the formula. The cursor also tracks parenthesis nesting against
 * {@link FormulaPolicy#maxNestingDepth()}, sizes expansions against
 * {@link FormulaPolicy#maxGeneratedColumns()}, and builds the {@link FormulaSyntaxException}s
 * raised by the grammar, so they always carry the consumed-lexeme prefix.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class TokenCursor {

    private final String formula;
    private final List<Token> tokens;
    private final FormulaPolicy policy;
    private final Token endOfInput;
    private int index;
    private int depth;

    TokenCursor(String formula, List<Token> tokens, FormulaPolicy policy) {
        this.formula = formula;
        this.tokens = tokens;
        this.policy = policy;
        this.endOfInput = new Token(TokenKind.END_OF_INPUT, "", formula.length());
    }

    Token peek() {
        return index < tokens.size() ? tokens.get(index) : endOfInput;
    }

    boolean matches(TokenKind kind) {
        return peek().kind() == kind;
    }

    Token next() {
        Token token = peek();
        if (index < tokens.size()) {
            index++;
        }
        return token;
    }

    /**
     * Consumes the next token if it has the given kind.
     *
     * @return true if a token was consumed
     */
    boolean accept(TokenKind kind) {
        if (matches(kind)) {
            index++;
            return true;
        }
        return false;
    }

    /**
     * Consumes the next token, which must have one of the given kinds.
     *
     * @throws FormulaSyntaxException if the next token has another kind
     */
    Token expect(TokenKind first, TokenKind... rest) {
        Set<TokenKind> accepted = EnumSet.of(first, rest);
        if (!accepted.contains(peek().kind())) {
            throw unexpected(accepted);
        }
        return next();
    }

    int index() {
        return index;
    }

    void enter() {
        if (++depth > policy.maxNestingDepth()) {
            throw new FormulaSyntaxException(String.format(
                "Formula nesting too deep (more than %d levels at position %d). Policy applied: %s",
                policy.maxNestingDepth(), peek().position(), policy.policyName()));
        }
    }

    void exit() {
        depth--;
    }

    /**
     * Rejects an expansion producing more terms than the policy allows.
     *
     * @param terms number of terms the expansion would produce
     * @param at    first token of the expanded expression
     */
    void checkExpansion(long terms, Token at) {
        if (terms > policy.maxGeneratedColumns()) {
            throw fail(String.format("Expansion too large (more than %d terms). Policy applied: %s",
                policy.maxGeneratedColumns(), policy.policyName()), at);
        }
    }

    /**
     * Error for the next token when it is not one of {@code expected}.
     */
    FormulaSyntaxException unexpected(Set<TokenKind> expected) {
        Token found = peek();
        String reason = found.kind() == TokenKind.UNKNOWN ? "Unrecognized character" : "Unexpected token";
        return new FormulaSyntaxException(reason, formula, expected, found, consumedLexemes(index));
    }

    /**
     * Error with a specific reason, located at {@code at}.
     */
    FormulaSyntaxException fail(String reason, Token at) {
        int consumed = tokens.indexOf(at);
        return new FormulaSyntaxException(reason, formula, EnumSet.noneOf(TokenKind.class), at,
            consumedLexemes(consumed < 0 ? index : consumed));
    }

    private List<String> consumedLexemes(int upTo) {
        List<String> lexemes = new ArrayList<>(upTo);
        for (int i = 0; i < upTo; i++) {
            lexemes.add(tokens.get(i).lexeme());
        }
        return lexemes;
    }
}
