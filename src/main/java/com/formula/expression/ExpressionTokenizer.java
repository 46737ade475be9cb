package com.formula.expression;

import com.formula.exception.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.formula.expression.ExpressionConfig.*;

/**
 * Tokenizer for formulas.
 * Converts input string into a sequence of tokens.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by an EOF token
     * @throws FormulaSyntaxException on an unexpected character or unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.PLUS -> {
                    advance();
                    tokens.add(new Token(TokenType.PLUS, "+", null, start));
                }
                case Operators.MINUS -> {
                    advance();
                    tokens.add(new Token(TokenType.MINUS, "-", null, start));
                }
                case Operators.STAR -> {
                    advance();
                    tokens.add(new Token(TokenType.STAR, "*", null, start));
                }
                case Operators.SLASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SLASH, "/", null, start));
                }
                case Operators.PERCENT -> {
                    advance();
                    tokens.add(new Token(TokenType.PERCENT, "%", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.EQ, "==", null, start));
                    } else {
                        throw error("Unexpected '=' (use '==' for equality)", start);
                    }
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, start));
                    } else {
                        throw error("Unexpected '!'", start);
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, start));
                    }
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (Character.isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        // Dotted segments address flattened nested values, e.g. customer.tier
        while (pos + 1 < length && peek() == Operators.DOT && isIdentifierStart(input.charAt(pos + 1))) {
            advance();
            while (!isAtEnd() && isIdentifierPart(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        String lower = text.toLowerCase(Locale.ROOT);

        // Check if it's a keyword
        TokenType keywordType = text.indexOf(Operators.DOT) < 0 ? KEYWORDS.get(lower) : null;
        if (keywordType != null) {
            Object literal = null;
            if (keywordType == TokenType.BOOLEAN) {
                literal = BOOLEAN_VALUES.get(lower);
            }
            return new Token(keywordType, lower, literal, start);
        }

        // Regular identifier
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }

        // A dot only belongs to the number when a digit follows it
        if (!isAtEnd() && peek() == Operators.DOT
                && pos + 1 < length && Character.isDigit(input.charAt(pos + 1))) {
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        Object number;

        try {
            if (text.contains(".")) {
                number = Double.parseDouble(text);
            } else {
                number = Long.parseLong(text);
            }
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }

        return new Token(TokenType.NUMBER, text, number, start);
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH) {
                if (isAtEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private FormulaSyntaxException error(String message, int position) {
        return new FormulaSyntaxException(message + " at position " + position, position);
    }
}
