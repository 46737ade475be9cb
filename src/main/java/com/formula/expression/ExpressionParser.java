package com.formula.expression;

import com.formula.ast.ArithmeticOperator;
import com.formula.ast.BinaryOp;
import com.formula.ast.BooleanLiteral;
import com.formula.ast.Comparison;
import com.formula.ast.ComparisonOperator;
import com.formula.ast.Expression;
import com.formula.ast.FieldReference;
import com.formula.ast.FunctionCall;
import com.formula.ast.LogicalOp;
import com.formula.ast.LogicalOperator;
import com.formula.ast.NullLiteral;
import com.formula.ast.NumberLiteral;
import com.formula.ast.StringLiteral;
import com.formula.ast.UnaryOp;
import com.formula.ast.UnaryOperator;
import com.formula.exception.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for formulas.
 * Converts tokens into an {@link Expression} tree using recursive descent parsing.
 * <p>
 * Grammar (lowest precedence first):
 * <pre>
 * expression     := or
 * or             := and ('or' and)*
 * and            := not ('and' not)*
 * not            := 'not' not | equality
 * equality       := relational (('==' | '!=') relational)*
 * relational     := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/' | '%') unary)*
 * unary          := ('-' | '+') unary | primary
 * primary        := NUMBER | STRING | 'true' | 'false' | 'null'
 *                 | IDENT | IDENT '(' arguments? ')' | '(' expression ')'
 * arguments      := expression (',' expression)*
 * </pre>
 * Trees deeper than {@link #MAX_DEPTH} levels are rejected, so every later pass over
 * the tree recurses a bounded number of times.
 */
public final class ExpressionParser {

    /**
     * Maximum nesting of parentheses, function calls and prefix operators, and maximum
     * depth of the resulting tree (long operator chains nest to the left).
     */
    public static final int MAX_DEPTH = 200;

    private final List<Token> tokens;
    private final Map<Expression, Integer> depths = new IdentityHashMap<>();
    private int index;
    private int nesting;

    public ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root expression
     * @throws FormulaSyntaxException if the tokens do not form a complete formula
     */
    public Expression parse() {
        if (check(TokenType.EOF)) {
            throw error("Empty formula");
        }
        Expression result = parseExpression();
        if (!check(TokenType.EOF)) {
            throw error("Unexpected token " + peek().type());
        }
        return result;
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            Expression right = parseAnd();
            left = node(new LogicalOp(LogicalOperator.OR, left, right), left, right);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            Expression right = parseNot();
            left = node(new LogicalOp(LogicalOperator.AND, left, right), left, right);
        }
        return left;
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            enter();
            Expression operand = parseNot();
            exit();
            return node(new UnaryOp(UnaryOperator.NOT, operand), operand);
        }
        return parseEquality();
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (true) {
            ComparisonOperator operator;
            if (match(TokenType.EQ)) {
                operator = ComparisonOperator.EQ;
            } else if (match(TokenType.NE)) {
                operator = ComparisonOperator.NE;
            } else {
                return left;
            }
            Expression right = parseRelational();
            left = node(new Comparison(operator, left, right), left, right);
        }
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (true) {
            ComparisonOperator operator;
            if (match(TokenType.LT)) {
                operator = ComparisonOperator.LT;
            } else if (match(TokenType.LTE)) {
                operator = ComparisonOperator.LTE;
            } else if (match(TokenType.GT)) {
                operator = ComparisonOperator.GT;
            } else if (match(TokenType.GTE)) {
                operator = ComparisonOperator.GTE;
            } else {
                return left;
            }
            Expression right = parseAdditive();
            left = node(new Comparison(operator, left, right), left, right);
        }
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (true) {
            ArithmeticOperator operator;
            if (match(TokenType.PLUS)) {
                operator = ArithmeticOperator.ADD;
            } else if (match(TokenType.MINUS)) {
                operator = ArithmeticOperator.SUBTRACT;
            } else {
                return left;
            }
            Expression right = parseMultiplicative();
            left = node(new BinaryOp(operator, left, right), left, right);
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (true) {
            ArithmeticOperator operator;
            if (match(TokenType.STAR)) {
                operator = ArithmeticOperator.MULTIPLY;
            } else if (match(TokenType.SLASH)) {
                operator = ArithmeticOperator.DIVIDE;
            } else if (match(TokenType.PERCENT)) {
                operator = ArithmeticOperator.MODULO;
            } else {
                return left;
            }
            Expression right = parseUnary();
            left = node(new BinaryOp(operator, left, right), left, right);
        }
    }

    private Expression parseUnary() {
        UnaryOperator operator;
        if (match(TokenType.MINUS)) {
            operator = UnaryOperator.NEGATE;
        } else if (match(TokenType.PLUS)) {
            operator = UnaryOperator.PLUS;
        } else {
            return parsePrimary();
        }
        enter();
        Expression operand = parseUnary();
        exit();
        return node(new UnaryOp(operator, operand), operand);
    }

    private Expression parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            enter();
            Expression expr = parseExpression();
            expect(TokenType.RPAREN);
            exit();
            return expr;
        }

        if (match(TokenType.NUMBER)) {
            return new NumberLiteral((Number) previous().literal());
        }
        if (match(TokenType.STRING)) {
            return new StringLiteral((String) previous().literal());
        }
        if (match(TokenType.BOOLEAN)) {
            return new BooleanLiteral((boolean) previous().literal());
        }
        if (match(TokenType.NULL)) {
            return new NullLiteral();
        }

        if (match(TokenType.IDENT)) {
            String name = previous().text();
            if (match(TokenType.LPAREN)) {
                enter();
                List<Expression> arguments = parseArguments();
                exit();
                return node(new FunctionCall(name, arguments), arguments.toArray(new Expression[0]));
            }
            return new FieldReference(name);
        }

        if (check(TokenType.EOF)) {
            throw error("Unexpected end of formula");
        }
        throw error("Unexpected token " + peek().type());
    }

    private List<Expression> parseArguments() {
        List<Expression> arguments = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return arguments;
        }

        arguments.add(parseExpression());
        while (match(TokenType.COMMA)) {
            arguments.add(parseExpression());
        }

        if (!match(TokenType.RPAREN)) {
            throw error("Expected ',' or ')' in function call, got " + peek().type());
        }
        return arguments;
    }

    private void enter() {
        if (++nesting > MAX_DEPTH) {
            throw tooDeep();
        }
    }

    private void exit() {
        nesting--;
    }

    /**
     * Record the depth of a freshly built node: one more than its deepest child.
     */
    private Expression node(Expression expression, Expression... children) {
        int depth = 1;
        for (Expression child : children) {
            depth = Math.max(depth, depths.getOrDefault(child, 1) + 1);
        }
        if (depth > MAX_DEPTH) {
            throw tooDeep();
        }
        depths.put(expression, depth);
        return expression;
    }

    private FormulaSyntaxException tooDeep() {
        return error("Formula nested too deeply (maximum depth " + MAX_DEPTH + ")");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + ", got " + peek().type());
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private FormulaSyntaxException error(String message) {
        int position = peek().position();
        return new FormulaSyntaxException(message + " at position " + position, position);
    }
}
