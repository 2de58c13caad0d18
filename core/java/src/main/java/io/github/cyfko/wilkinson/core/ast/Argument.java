package io.github.cyfko.wilkinson.core.ast;

import java.util.Objects;

/**
 * Argument of a function call or a top-level assignment.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Argument {

    /**
     * @return the argument as it would be written in a formula
     */
    String render();

    /**
     * A term argument: a variable or a nested call.
     *
     * @param term the argument term
     */
    record TermArgument(Term term) implements Argument {
        public TermArgument {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public String render() {
            return term.label();
        }
    }

    /**
     * A numeric literal, kept as written ({@code 3}, {@code -0.5}).
     *
     * @param lexeme the literal text, including a leading minus when negative
     */
    record NumericArgument(String lexeme) implements Argument {
        public NumericArgument {
            Objects.requireNonNull(lexeme, "lexeme");
        }

        /**
         * @return true when the literal has no fractional part
         */
        public boolean isInteger() {
            return lexeme.indexOf('.') < 0;
        }

        public double doubleValue() {
            return Double.parseDouble(lexeme);
        }

        @Override
        public String render() {
            return lexeme;
        }
    }

    /**
     * A string literal without its quotes.
     *
     * @param value unquoted content
     */
    record StringArgument(String value) implements Argument {
        public StringArgument {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return '"' + value + '"';
        }
    }

    record BooleanArgument(boolean value) implements Argument {
        @Override
        public String render() {
            return value ? "TRUE" : "FALSE";
        }
    }

    record NullArgument() implements Argument {
        @Override
        public String render() {
            return "NULL";
        }
    }

    /**
     * A {@code key = value} argument.
     *
     * @param key   argument name
     * @param value argument value
     */
    record NamedArgument(String key, Argument value) implements Argument {
        public NamedArgument {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return key + " = " + value.render();
        }
    }
}
