package io.github.cyfko.wilkinson.core.parsing;

import io.github.cyfko.wilkinson.core.ast.Argument;
import io.github.cyfko.wilkinson.core.ast.ColumnName;
import io.github.cyfko.wilkinson.core.ast.Correlation;
import io.github.cyfko.wilkinson.core.ast.CorrelationKind;
import io.github.cyfko.wilkinson.core.ast.Formula;
import io.github.cyfko.wilkinson.core.ast.FormulaProgram;
import io.github.cyfko.wilkinson.core.ast.FunctionCall;
import io.github.cyfko.wilkinson.core.ast.GrOptions;
import io.github.cyfko.wilkinson.core.ast.GroupExpression;
import io.github.cyfko.wilkinson.core.ast.Intercept;
import io.github.cyfko.wilkinson.core.ast.InterceptSpec;
import io.github.cyfko.wilkinson.core.ast.Interaction;
import io.github.cyfko.wilkinson.core.ast.InteractionOperator;
import io.github.cyfko.wilkinson.core.ast.ProgramEntry;
import io.github.cyfko.wilkinson.core.ast.RandomEffect;
import io.github.cyfko.wilkinson.core.ast.Response;
import io.github.cyfko.wilkinson.core.ast.Term;
import io.github.cyfko.wilkinson.core.ast.Zero;
import io.github.cyfko.wilkinson.core.config.FormulaPolicy;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.lexer.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static io.github.cyfko.wilkinson.core.lexer.TokenKind.*;

/**
 * Recursive-descent parser turning a token list into a {@link FormulaProgram}.
 * <p>
 * The grammar is LL(1): keyword tokens tell calls from plain names, and the two places where a
 * name is ambiguous ({@code key = value} arguments, {@code |id|} correlation ids) are resolved by
 * consuming the name first and deciding on the token that follows it. Parsing stops at the first
 * violation with a {@link FormulaSyntaxException}; there is no recovery.
 * </p>
 *
 * <h2>Grammar</h2>
 * <pre>
 * program     := formula ( ',' entry )* EOI
 * entry       := name '~' rhs | name '=' value
 * formula     := [ lhs ] '~' rhs
 * lhs         := name | ('bind' | 'mvbind') '(' name ( ',' name )+ ')'
 * rhs         := addend ( '+' addend | '-' subtrahend )*  |  '-' subtrahend ...
 * addend      := '1' | '0' | paren | interaction
 * subtrahend  := '1' | interaction
 * paren       := '(' rhs ( '|' [ id '|' ] group | '||' group ) ')'
 *              | '(' rhs ')' [ '^' integer ]
 * interaction := atomic ( ( ':' | '*' ) atomic )*
 * atomic      := name [ '(' args ')' ] | function-keyword '(' args ')'
 * group       := name ( ':' name )* | name ( '/' name )* | 'gr' '(' name ( ',' option )* ')'
 *              | 'mm' '(' name ( ',' name )+ ')'
 * arg         := name '=' value | value
 * value       := atomic | [ '-' ] number | string | TRUE | FALSE | NULL
 * </pre>
 *
 * <h2>Intercept rules</h2>
 * <p>
 * Within one formula (and separately within each random-effect term) {@code 1} marks the
 * intercept present while {@code 0} and {@code -1} mark it absent. Marking it both ways is a
 * "contradictory intercept specification"; {@code - 0} is rejected.
 * </p>
 * <p>
 * Removed terms are recorded by {@link Term#key()}, so {@code - b:a} removes {@code a:b}.
 * Interaction chains and {@code ^k} expansions are sized before they are expanded and rejected
 * above {@link FormulaPolicy#maxGeneratedColumns()} terms.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaGrammar {

    private static final Set<TokenKind> TERM_START =
        EnumSet.of(COLUMN_NAME, POLY, LOG, MO, CS, ME, MI, MMC, ONE, ZERO, LPAREN);
    private static final Set<TokenKind> ATOMIC_START =
        EnumSet.of(COLUMN_NAME, POLY, LOG, MO, CS, ME, MI, MMC);
    private static final Set<TokenKind> AFTER_TERM =
        EnumSet.of(PLUS, MINUS, STAR, COLON, COMMA, END_OF_INPUT);
    private static final Set<TokenKind> AFTER_GROUP_TERMS =
        EnumSet.of(PLUS, MINUS, STAR, COLON, PIPE, DOUBLE_PIPE, RPAREN);
    private static final Set<TokenKind> GROUP_START = EnumSet.of(COLUMN_NAME, GR, MM);
    private static final Set<TokenKind> GR_OPTIONS = EnumSet.of(COR, ID, BY, COV, DIST);
    private static final Set<TokenKind> VALUE_START =
        EnumSet.of(COLUMN_NAME, INTEGER, NUMBER, ONE, ZERO, MINUS, STRING_LITERAL, TRUE, FALSE, NULL);

    private final TokenCursor cursor;

    private FormulaGrammar(TokenCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Parses a token list produced by {@code Lexer.lex(formula)}.
     *
     * @param formula the original text, used for positions and diagnostics
     * @param tokens  the tokens of {@code formula}
     * @param policy  nesting limits to enforce
     * @return the parsed program
     * @throws FormulaSyntaxException on the first grammar violation
     */
    public static FormulaProgram parse(String formula, List<Token> tokens, FormulaPolicy policy) {
        return new FormulaGrammar(new TokenCursor(formula, tokens, policy)).program();
    }

    private FormulaProgram program() {
        Formula main = formula();
        List<ProgramEntry> entries = new ArrayList<>();
        while (cursor.accept(COMMA)) {
            entries.add(entry());
        }
        if (!cursor.matches(END_OF_INPUT)) {
            throw cursor.unexpected(AFTER_TERM);
        }
        return new FormulaProgram(main, entries);
    }

    private Formula formula() {
        Response response = cursor.matches(TILDE) ? null : response();
        cursor.expect(TILDE);
        TermList rhs = termList(false);
        return new Formula(response, rhs.terms, rhs.dropped, rhs.intercept);
    }

    private Response response() {
        Token first = cursor.peek();
        if (first.kind() == BIND || first.kind() == MVBIND) {
            cursor.next();
            cursor.expect(LPAREN);
            List<String> names = new ArrayList<>();
            names.add(name());
            while (cursor.accept(COMMA)) {
                names.add(name());
            }
            Token close = cursor.expect(RPAREN);
            if (names.size() < 2) {
                throw cursor.fail("a multivariate response needs at least two variables", close);
            }
            return new Response(names, true);
        }
        if (!first.kind().isName()) {
            throw cursor.unexpected(EnumSet.of(COLUMN_NAME, BIND, MVBIND, TILDE));
        }
        return new Response(List.of(name()), false);
    }

    private ProgramEntry entry() {
        String key = name();
        if (cursor.accept(TILDE)) {
            TermList rhs = termList(false);
            return new ProgramEntry.ParameterFormula(key, new Formula(null, rhs.terms, rhs.dropped, rhs.intercept));
        }
        if (cursor.accept(EQUAL)) {
            return new ProgramEntry.Assignment(key, value());
        }
        throw cursor.unexpected(EnumSet.of(TILDE, EQUAL));
    }

    // ---------------------------------------------------------------- terms

    /**
     * Parses {@code +}/{@code -} separated terms up to the first token that cannot continue
     * the list. The caller checks that token.
     */
    private TermList termList(boolean insideParentheses) {
        TermList list = new TermList();
        if (cursor.matches(MINUS)) {
            subtrahend(list);
        } else {
            addend(list);
        }
        while (true) {
            int before = cursor.index();
            if (cursor.accept(PLUS)) {
                addend(list);
            } else if (cursor.matches(MINUS)) {
                subtrahend(list);
            } else {
                break;
            }
            if (cursor.index() <= before + 1) {
                // every term consumes at least one token after its operator
                throw cursor.unexpected(insideParentheses ? AFTER_GROUP_TERMS : AFTER_TERM);
            }
        }
        return list;
    }

    private void addend(TermList list) {
        Token token = cursor.peek();
        switch (token.kind()) {
            case ONE:
                list.mark(InterceptSpec.PRESENT, token);
                cursor.next();
                list.terms.add(new Intercept());
                break;
            case ZERO:
                list.mark(InterceptSpec.ABSENT, token);
                cursor.next();
                list.terms.add(new Zero(false));
                break;
            case LPAREN:
                parenthesized(list);
                break;
            default:
                list.terms.add(interaction(TERM_START));
        }
    }

    private void subtrahend(TermList list) {
        cursor.expect(MINUS);
        Token token = cursor.peek();
        if (token.kind() == ONE) {
            list.mark(InterceptSpec.ABSENT, token);
            cursor.next();
            list.terms.add(new Zero(true));
            return;
        }
        if (token.kind() == ZERO) {
            throw cursor.fail("'0' cannot be removed from a formula", token);
        }
        Term removed = interaction(EnumSet.of(ONE, COLUMN_NAME, POLY, LOG, MO, CS, ME, MI, MMC));
        if (removed instanceof Interaction) {
            for (Term expanded : ((Interaction) removed).expand()) {
                list.dropped.add(expanded.key());
            }
        } else {
            list.dropped.add(removed.key());
        }
    }

    private void parenthesized(TermList outer) {
        cursor.expect(LPAREN);
        cursor.enter();
        TermList inner = termList(true);
        Token bar = cursor.peek();

        if (bar.kind() == PIPE || bar.kind() == DOUBLE_PIPE) {
            cursor.next();
            RandomEffect effect = randomEffect(inner, bar);
            cursor.expect(RPAREN);
            cursor.exit();
            outer.terms.add(effect);
            return;
        }
        if (bar.kind() != RPAREN) {
            throw cursor.unexpected(AFTER_GROUP_TERMS);
        }
        cursor.next();
        cursor.exit();

        if (inner.intercept != InterceptSpec.IMPLICIT) {
            outer.mark(inner.intercept, inner.interceptToken);
        }
        outer.dropped.addAll(inner.dropped);

        if (cursor.matches(CARET)) {
            Token caret = cursor.next();
            Token order = cursor.expect(ONE, INTEGER);
            outer.terms.addAll(powerExpansion(inner, expansionOrder(order), caret));
        } else {
            outer.terms.addAll(inner.terms);
        }
    }

    private RandomEffect randomEffect(TermList inner, Token bar) {
        Correlation correlation;
        GroupExpression group;
        if (bar.kind() == DOUBLE_PIPE) {
            correlation = Correlation.uncorrelated();
            group = groupExpression(null);
        } else {
            Token next = cursor.peek();
            if (next.kind() == INTEGER || next.kind() == ONE || next.kind() == ZERO || next.kind() == NUMBER) {
                cursor.next();
                cursor.expect(PIPE);
                correlation = Correlation.crossParameter(next.lexeme());
                group = groupExpression(null);
            } else if (next.kind().isName()) {
                // either the correlation id of (x |p| g) or the first name of the group
                String name = name();
                if (cursor.accept(PIPE)) {
                    correlation = Correlation.crossParameter(name);
                    group = groupExpression(null);
                } else {
                    correlation = Correlation.correlated();
                    group = groupExpression(name);
                }
            } else {
                correlation = Correlation.correlated();
                group = groupExpression(null);
            }
        }

        List<Term> effects = new ArrayList<>();
        for (Term term : inner.terms) {
            if (term instanceof RandomEffect) {
                throw cursor.fail("random-effect terms cannot be nested", bar);
            }
            if (term instanceof Intercept || term instanceof Zero) {
                continue;
            }
            if (inner.dropped.isEmpty()) {
                effects.add(term);
            } else if (term instanceof Interaction && !((Interaction) term).isProductOnly()) {
                for (Term expanded : ((Interaction) term).expand()) {
                    if (!inner.dropped.contains(expanded.key())) {
                        effects.add(expanded);
                    }
                }
            } else if (!inner.dropped.contains(term.key())) {
                effects.add(term);
            }
        }

        if (group instanceof GroupExpression.GrGroup) {
            GrOptions options = ((GroupExpression.GrGroup) group).options();
            if (!options.correlated() && correlation.kind() == CorrelationKind.CORRELATED) {
                correlation = Correlation.uncorrelated();
            }
            if (options.id() != null && correlation.kind() == CorrelationKind.CORRELATED) {
                correlation = Correlation.crossParameter(options.id());
            }
        }

        return new RandomEffect(effects, group, correlation, inner.intercept != InterceptSpec.ABSENT);
    }

    private List<Term> powerExpansion(TermList inner, int order, Token caret) {
        List<List<Term>> factors = new ArrayList<>();
        for (Term term : inner.terms) {
            if (term instanceof RandomEffect) {
                throw cursor.fail("random-effect terms cannot be raised to a power", caret);
            }
            if (term instanceof Intercept || term instanceof Zero) {
                continue;
            }
            List<Term> expanded = term instanceof Interaction ? ((Interaction) term).expand() : List.of(term);
            for (Term factor : expanded) {
                factors.add(factor instanceof Interaction ? ((Interaction) factor).operands() : List.of(factor));
            }
        }
        cursor.checkExpansion(Interaction.expansionSize(factors.size(), order), caret);
        return Interaction.combine(factors, order);
    }

    private int expansionOrder(Token order) {
        int value;
        try {
            value = Integer.parseInt(order.lexeme());
        } catch (NumberFormatException tooLarge) {
            throw cursor.fail("expansion order out of range", order);
        }
        if (value < 1) {
            throw cursor.fail("expansion order must be positive", order);
        }
        return value;
    }

    /**
     * Parses an interaction chain. All operands of the chain are folded into one node.
     *
     * @param expected token kinds reported when the first operand is missing
     */
    private Term interaction(Set<TokenKind> expected) {
        Token start = cursor.peek();
        List<Term> operands = new ArrayList<>();
        List<InteractionOperator> operators = new ArrayList<>();
        operands.add(atomic(expected));
        while (cursor.matches(STAR) || cursor.matches(COLON)) {
            operators.add(cursor.next().kind() == STAR ? InteractionOperator.FULL : InteractionOperator.ONLY);
            operands.add(atomic(ATOMIC_START));
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        Interaction chain = new Interaction(operands, operators);
        cursor.checkExpansion(Interaction.expansionSize(chain.factorCount(), chain.factorCount()), start);
        return chain;
    }

    private Term atomic(Set<TokenKind> expected) {
        Token token = cursor.peek();
        TokenKind kind = token.kind();
        if (kind.isName()) {
            cursor.next();
            return cursor.matches(LPAREN) ? functionCall(token.lexeme()) : new ColumnName(token.lexeme());
        }
        if (kind.isFunctionKeyword()) {
            if (kind == GR || kind == MM) {
                throw cursor.fail("'" + token.lexeme() + "' is only valid as a grouping expression", token);
            }
            if (kind == BIND || kind == MVBIND) {
                throw cursor.fail("'" + token.lexeme() + "' is only valid on the left-hand side", token);
            }
            cursor.next();
            if (!cursor.matches(LPAREN)) {
                throw cursor.unexpected(EnumSet.of(LPAREN));
            }
            return functionCall(token.lexeme());
        }
        if (kind == ONE || kind == ZERO) {
            throw cursor.fail("the intercept cannot be part of an interaction", token);
        }
        throw cursor.unexpected(expected);
    }

    private FunctionCall functionCall(String name) {
        cursor.expect(LPAREN);
        cursor.enter();
        List<Argument> arguments = new ArrayList<>();
        if (!cursor.matches(RPAREN)) {
            arguments.add(argument());
            while (cursor.accept(COMMA)) {
                arguments.add(argument());
            }
        }
        closeArguments();
        return new FunctionCall(name, arguments);
    }

    private Argument argument() {
        Token token = cursor.peek();
        if (!token.kind().isName()) {
            return value();
        }
        cursor.next();
        if (cursor.accept(EQUAL)) {
            return new Argument.NamedArgument(token.lexeme(), value());
        }
        if (cursor.matches(LPAREN)) {
            return new Argument.TermArgument(functionCall(token.lexeme()));
        }
        return new Argument.TermArgument(new ColumnName(token.lexeme()));
    }

    private Argument value() {
        Token token = cursor.peek();
        switch (token.kind()) {
            case INTEGER: case NUMBER: case ONE: case ZERO:
                cursor.next();
                return new Argument.NumericArgument(token.lexeme());
            case MINUS:
                cursor.next();
                Token number = cursor.expect(INTEGER, NUMBER, ONE, ZERO);
                return new Argument.NumericArgument("-" + number.lexeme());
            case STRING_LITERAL:
                cursor.next();
                return new Argument.StringArgument(unquote(token.lexeme()));
            case TRUE:
                cursor.next();
                return new Argument.BooleanArgument(true);
            case FALSE:
                cursor.next();
                return new Argument.BooleanArgument(false);
            case NULL:
                cursor.next();
                return new Argument.NullArgument();
            default:
                if (token.kind().isName() || token.kind().isFunctionKeyword()) {
                    return new Argument.TermArgument(atomic(VALUE_START));
                }
                throw cursor.unexpected(VALUE_START);
        }
    }

    // ---------------------------------------------------------------- grouping

    /**
     * Parses the grouping side of a random-effect term.
     *
     * @param firstName a name already consumed while looking for a correlation id, or null
     */
    private GroupExpression groupExpression(String firstName) {
        if (firstName == null) {
            Token token = cursor.peek();
            if (token.kind() == GR) {
                return grGroup();
            }
            if (token.kind() == MM) {
                return multiMembership();
            }
            if (!token.kind().isName()) {
                throw cursor.unexpected(GROUP_START);
            }
            firstName = name();
        }

        if (!cursor.matches(COLON) && !cursor.matches(SLASH)) {
            return new GroupExpression.SimpleGroup(firstName);
        }
        TokenKind separator = cursor.peek().kind();
        List<String> names = new ArrayList<>();
        names.add(firstName);
        while (cursor.matches(COLON) || cursor.matches(SLASH)) {
            Token sep = cursor.next();
            if (sep.kind() != separator) {
                throw cursor.fail("':' and '/' cannot be mixed in one grouping expression", sep);
            }
            names.add(name());
        }
        return separator == COLON
            ? new GroupExpression.InteractionGroup(names)
            : new GroupExpression.NestedGroup(names);
    }

    private GroupExpression grGroup() {
        cursor.expect(GR);
        cursor.expect(LPAREN);
        cursor.enter();
        String name = name();
        Boolean cor = null;
        String id = null;
        String by = null;
        Boolean cov = null;
        String dist = null;
        Set<TokenKind> seen = EnumSet.noneOf(TokenKind.class);

        while (cursor.accept(COMMA)) {
            Token option = cursor.peek();
            if (!GR_OPTIONS.contains(option.kind())) {
                throw cursor.unexpected(GR_OPTIONS);
            }
            if (!seen.add(option.kind())) {
                throw cursor.fail("duplicate gr() option '" + option.lexeme() + "'", option);
            }
            cursor.next();
            cursor.expect(EQUAL);
            switch (option.kind()) {
                case COR:
                    cor = cursor.expect(TRUE, FALSE).kind() == TRUE;
                    break;
                case COV:
                    cov = cursor.expect(TRUE, FALSE).kind() == TRUE;
                    break;
                case ID: {
                    Token value = cursor.peek();
                    if (value.kind().isName()) {
                        id = name();
                    } else {
                        Token literal = cursor.expect(STRING_LITERAL, INTEGER, ONE, ZERO, NUMBER);
                        id = literal.kind() == STRING_LITERAL ? unquote(literal.lexeme()) : literal.lexeme();
                    }
                    break;
                }
                case BY:
                    if (!cursor.accept(NULL)) {
                        by = name();
                    }
                    break;
                default: {
                    Token value = cursor.peek();
                    if (value.kind().isName()) {
                        dist = name();
                    } else {
                        dist = unquote(cursor.expect(STRING_LITERAL).lexeme());
                    }
                }
            }
        }
        closeArguments();
        return new GroupExpression.GrGroup(name, new GrOptions(cor, id, by, cov, dist));
    }

    private GroupExpression multiMembership() {
        cursor.expect(MM);
        cursor.expect(LPAREN);
        cursor.enter();
        List<String> names = new ArrayList<>();
        names.add(name());
        while (cursor.accept(COMMA)) {
            names.add(name());
        }
        Token close = closeArguments();
        if (names.size() < 2) {
            throw cursor.fail("mm() needs at least two grouping variables", close);
        }
        return new GroupExpression.MultiMembershipGroup(names);
    }

    /**
     * Consumes the {@code )} ending an argument list opened with {@link TokenCursor#enter()}.
     */
    private Token closeArguments() {
        if (!cursor.matches(RPAREN)) {
            throw cursor.unexpected(EnumSet.of(RPAREN, COMMA));
        }
        cursor.exit();
        return cursor.next();
    }

    private String name() {
        if (!cursor.peek().kind().isName()) {
            throw cursor.unexpected(EnumSet.of(COLUMN_NAME));
        }
        return cursor.next().lexeme();
    }

    private static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1);
    }

    /**
     * Terms of one {@code +}/{@code -} list with their intercept status.
     */
    private final class TermList {
        final List<Term> terms = new ArrayList<>();
        final Set<String> dropped = new LinkedHashSet<>();
        InterceptSpec intercept = InterceptSpec.IMPLICIT;
        Token interceptToken;

        void mark(InterceptSpec spec, Token at) {
            if (intercept != InterceptSpec.IMPLICIT && intercept != spec) {
                throw cursor.fail("contradictory intercept specification", at);
            }
            if (interceptToken == null) {
                interceptToken = at;
            }
            intercept = spec;
        }
    }
}
