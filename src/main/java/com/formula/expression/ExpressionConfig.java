package com.formula.expression;

import java.util.Map;

/**
 * Configuration for formula keywords and operators.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types. Matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Logical
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),

            // Literals
            Map.entry("true", TokenType.BOOLEAN),
            Map.entry("false", TokenType.BOOLEAN),
            Map.entry("null", TokenType.NULL)
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "true", true,
            "false", false
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char PERCENT = '%';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
