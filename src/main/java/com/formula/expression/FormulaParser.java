package com.formula.expression;

import com.formula.ast.Expression;
import com.formula.exception.FormulaSyntaxException;

import java.util.List;

/**
 * Facade for parsing formula text into an {@link Expression} tree.
 * <p>
 * Supports:
 * <ul>
 *   <li>Arithmetic: +, -, *, /, % and unary -, +</li>
 *   <li>Comparisons: ==, !=, &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>Logical operators: and, or, not</li>
 *   <li>Literals: numbers, quoted strings, true, false, null</li>
 *   <li>Field references and function calls</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: unary -/+ &gt; * / % &gt; + - &gt; relational &gt; equality &gt; not &gt; and &gt; or
 */
public final class FormulaParser {

    private FormulaParser() {
    }

    /**
     * Parse a formula into an expression tree.
     *
     * @param formula Formula text
     * @return Parsed expression
     * @throws FormulaSyntaxException if the formula is blank or malformed
     */
    public static Expression parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaSyntaxException("Empty formula", 0);
        }

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(formula);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(tokens);
        return parser.parse();
    }
}
