package io.github.cyfko.wilkinson.core.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of token kinds produced by the {@link Lexer}.
 * <p>
 * Each kind carries the display label used by diagnostics and by the raw token stream
 * ({@code lex_formula}) and, for fixed-spelling kinds, the literal text it stands for.
 * Keyword kinds are recognised case-sensitively.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {

    // structural
    TILDE("Tilde", "~"),
    PLUS("Plus", "+"),
    MINUS("Minus", "-"),
    STAR("InteractionAndEffect", "*"),
    COLON("InteractionOnly", ":"),
    PIPE("Pipe", "|"),
    DOUBLE_PIPE("DoublePipe", "||"),
    LPAREN("FunctionStart", "("),
    RPAREN("FunctionEnd", ")"),
    COMMA("Comma", ","),
    CARET("Caret", "^"),
    EQUAL("Equal", "="),
    SLASH("Slash", "/"),

    // literals
    ONE("One", "1"),
    ZERO("Zero", "0"),
    INTEGER("Integer", null),
    NUMBER("Number", null),
    STRING_LITERAL("StringLiteral", null),
    TRUE("True", null),
    FALSE("False", null),
    NULL("Null", null),

    COLUMN_NAME("ColumnName", null),

    // function keywords
    POLY("Poly", "poly"),
    LOG("Log", "log"),
    MO("Mo", "mo"),
    CS("Cs", "cs"),
    ME("Me", "me"),
    MI("Mi", "mi"),
    GR("Gr", "gr"),
    MM("Mm", "mm"),
    MMC("Mmc", "mmc"),
    BIND("Bind", "bind"),
    MVBIND("MvBind", "mvbind"),

    // grouping-argument keywords
    COR("Cor", "cor"),
    ID("Id", "id"),
    BY("By", "by"),
    COV("Cov", "cov"),
    DIST("Dist", "dist"),

    UNKNOWN("Unknown", null),
    END_OF_INPUT("EndOfInput", null);

    private static final Map<String, TokenKind> RESERVED_WORDS;

    static {
        Map<String, TokenKind> words = new HashMap<>();
        for (TokenKind kind : values()) {
            if (kind.isFunctionKeyword() || kind.isArgumentKeyword()) {
                words.put(kind.text, kind);
            }
        }
        words.put("true", TRUE);
        words.put("TRUE", TRUE);
        words.put("false", FALSE);
        words.put("FALSE", FALSE);
        words.put("null", NULL);
        words.put("NULL", NULL);
        RESERVED_WORDS = Collections.unmodifiableMap(words);
    }

    private final String label;
    private final String text;

    TokenKind(String label, String text) {
        this.label = label;
        this.text = text;
    }

    /**
     * @return the display label, e.g. {@code "ColumnName"} or {@code "Tilde"}
     */
    public String label() {
        return label;
    }

    /**
     * Whether this kind names a function that must be followed by {@code (}.
     *
     * @return true for {@code poly}, {@code log}, {@code mo}, {@code cs}, {@code me}, {@code mi},
     *         {@code gr}, {@code mm}, {@code mmc}, {@code bind} and {@code mvbind}
     */
    public boolean isFunctionKeyword() {
        switch (this) {
            case POLY: case LOG: case MO: case CS: case ME: case MI:
            case GR: case MM: case MMC: case BIND: case MVBIND:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether this kind is one of the {@code gr()} option keywords. These double as plain
     * column names outside an option position.
     *
     * @return true for {@code cor}, {@code id}, {@code by}, {@code cov} and {@code dist}
     */
    public boolean isArgumentKeyword() {
        return this == COR || this == ID || this == BY || this == COV || this == DIST;
    }

    /**
     * Whether a token of this kind can be read as a variable name.
     *
     * @return true for {@link #COLUMN_NAME} and the argument keywords
     */
    public boolean isName() {
        return this == COLUMN_NAME || isArgumentKeyword();
    }

    /**
     * Looks up the keyword kind for an identifier.
     *
     * @param word identifier text
     * @return the reserved kind, or {@link #COLUMN_NAME} when the word is not reserved
     */
    static TokenKind classifyWord(String word) {
        return RESERVED_WORDS.getOrDefault(word, COLUMN_NAME);
    }
}
