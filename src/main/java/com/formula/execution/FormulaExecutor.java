package com.formula.execution;

import com.formula.analysis.FormulaValidator;
import com.formula.ast.ArithmeticOperator;
import com.formula.ast.BinaryOp;
import com.formula.ast.BooleanLiteral;
import com.formula.ast.Comparison;
import com.formula.ast.ComparisonOperator;
import com.formula.ast.Expression;
import com.formula.ast.ExpressionVisitor;
import com.formula.ast.FieldReference;
import com.formula.ast.FunctionCall;
import com.formula.ast.LogicalOp;
import com.formula.ast.LogicalOperator;
import com.formula.ast.NullLiteral;
import com.formula.ast.NumberLiteral;
import com.formula.ast.StringLiteral;
import com.formula.ast.UnaryOp;
import com.formula.core.Values;
import com.formula.exception.FormulaEvaluationException;
import com.formula.exception.FormulaSyntaxException;
import com.formula.expression.FormulaParser;
import com.formula.function.FormulaFunction;
import com.formula.function.FunctionDefinition;
import com.formula.function.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes formulas against concrete field values.
 * <p>
 * Integer arithmetic stays integral for {@code + - * %}; {@code /} always yields a
 * decimal. {@code and}/{@code or} short-circuit and return booleans. Values and
 * function maps passed in are only read.
 */
public class FormulaExecutor {

    private static final Logger log = LoggerFactory.getLogger(FormulaExecutor.class);

    public ExecutionResult execute(String formula, Map<String, ?> values) {
        return execute(formula, values, Map.of());
    }

    /**
     * Parse and execute a formula.
     *
     * @param formula        Formula text
     * @param values         Field values keyed by field id
     * @param extraFunctions Additional callables by name; built-ins take precedence
     * @return Execution result, never null
     */
    public ExecutionResult execute(String formula, Map<String, ?> values,
                                   Map<String, FormulaFunction> extraFunctions) {
        Expression expression;
        try {
            expression = FormulaParser.parse(formula);
        } catch (FormulaSyntaxException e) {
            return ExecutionResult.failure(FormulaValidator.syntaxErrorMessage(e));
        }
        return execute(expression, values, extraFunctions);
    }

    /**
     * Execute an already parsed formula.
     */
    public ExecutionResult execute(Expression expression, Map<String, ?> values,
                                   Map<String, FormulaFunction> extraFunctions) {
        Objects.requireNonNull(values, "values cannot be null");
        Map<String, ?> readOnlyValues = Collections.unmodifiableMap(values);
        Map<String, FormulaFunction> functions = extraFunctions == null ? Map.of() : extraFunctions;
        try {
            Object value = expression.accept(new Evaluation(readOnlyValues, functions));
            return ExecutionResult.success(value);
        } catch (FormulaEvaluationException e) {
            log.debug("Execution of '{}' failed: {}", expression, e.getMessage());
            return ExecutionResult.failure(e.getMessage());
        } catch (ArithmeticException e) {
            log.debug("Execution of '{}' failed: {}", expression, e.getMessage());
            return ExecutionResult.failure("Arithmetic error: " + e.getMessage());
        }
    }

    private static final class Evaluation implements ExpressionVisitor<Object> {

        private final Map<String, ?> values;
        private final Map<String, FormulaFunction> extraFunctions;

        private Evaluation(Map<String, ?> values, Map<String, FormulaFunction> extraFunctions) {
            this.values = values;
            this.extraFunctions = extraFunctions;
        }

        @Override
        public Object visitNumber(NumberLiteral node) {
            return node.value();
        }

        @Override
        public Object visitString(StringLiteral node) {
            return node.value();
        }

        @Override
        public Object visitBoolean(BooleanLiteral node) {
            return node.value();
        }

        @Override
        public Object visitNull(NullLiteral node) {
            return null;
        }

        @Override
        public Object visitFieldReference(FieldReference node) {
            if (!values.containsKey(node.fieldId())) {
                throw new FormulaEvaluationException("Field '" + node.fieldId() + "' not found in values");
            }
            return normalize(values.get(node.fieldId()));
        }

        @Override
        public Object visitUnary(UnaryOp node) {
            Object operand = node.operand().accept(this);
            switch (node.operator()) {
                case NOT:
                    return !Values.isTruthy(operand);
                case PLUS:
                    return requireNumber(node.operator().symbol(), operand);
                case NEGATE:
                default:
                    Number number = requireNumber(node.operator().symbol(), operand);
                    if (Values.isIntegral(number)) {
                        return Math.negateExact(number.longValue());
                    }
                    return -number.doubleValue();
            }
        }

        @Override
        public Object visitBinary(BinaryOp node) {
            Object left = node.left().accept(this);
            Object right = node.right().accept(this);
            String symbol = node.operator().symbol();

            if (node.operator() == ArithmeticOperator.ADD
                    && left instanceof String leftText && right instanceof String rightText) {
                return leftText + rightText;
            }
            if (!(left instanceof Number) || !(right instanceof Number)) {
                throw new FormulaEvaluationException("Unsupported operand types for '" + symbol + "': "
                        + Values.typeName(left) + " and " + Values.typeName(right));
            }
            Number l = (Number) left;
            Number r = (Number) right;
            boolean integral = Values.isIntegral(l) && Values.isIntegral(r);

            switch (node.operator()) {
                case ADD:
                    return integral ? (Object) Math.addExact(l.longValue(), r.longValue())
                            : l.doubleValue() + r.doubleValue();
                case SUBTRACT:
                    return integral ? (Object) Math.subtractExact(l.longValue(), r.longValue())
                            : l.doubleValue() - r.doubleValue();
                case MULTIPLY:
                    return integral ? (Object) Math.multiplyExact(l.longValue(), r.longValue())
                            : l.doubleValue() * r.doubleValue();
                case DIVIDE:
                    if (r.doubleValue() == 0.0) {
                        throw new FormulaEvaluationException("Division by zero");
                    }
                    return l.doubleValue() / r.doubleValue();
                case MODULO:
                default:
                    if (r.doubleValue() == 0.0) {
                        throw new FormulaEvaluationException("Modulo by zero");
                    }
                    if (integral) {
                        return Math.floorMod(l.longValue(), r.longValue());
                    }
                    double dividend = l.doubleValue();
                    double divisor = r.doubleValue();
                    return dividend - divisor * Math.floor(dividend / divisor);
            }
        }

        @Override
        public Object visitLogical(LogicalOp node) {
            boolean left = Values.isTruthy(node.left().accept(this));
            if (node.operator() == LogicalOperator.AND) {
                return left && Values.isTruthy(node.right().accept(this));
            }
            return left || Values.isTruthy(node.right().accept(this));
        }

        @Override
        public Object visitComparison(Comparison node) {
            Object left = node.left().accept(this);
            Object right = node.right().accept(this);

            if (node.operator().isEquality()) {
                boolean equal = Values.areEqual(left, right);
                return node.operator() == ComparisonOperator.EQ ? equal : !equal;
            }

            int cmp;
            if (left instanceof Number l && right instanceof Number r) {
                cmp = Double.compare(l.doubleValue(), r.doubleValue());
            } else if (left instanceof String leftText && right instanceof String rightText) {
                cmp = leftText.compareTo(rightText);
            } else {
                throw new FormulaEvaluationException("Cannot compare " + Values.typeName(left) + " with "
                        + Values.typeName(right) + " using '" + node.operator().symbol() + "'");
            }

            switch (node.operator()) {
                case LT:
                    return cmp < 0;
                case LTE:
                    return cmp <= 0;
                case GT:
                    return cmp > 0;
                case GTE:
                default:
                    return cmp >= 0;
            }
        }

        @Override
        public Object visitFunctionCall(FunctionCall node) {
            List<Object> arguments = new ArrayList<>();
            for (Expression argument : node.arguments()) {
                arguments.add(argument.accept(this));
            }
            List<Object> args = Collections.unmodifiableList(arguments);

            Optional<FunctionDefinition> builtin = FunctionRegistry.find(node.name());
            if (builtin.isPresent()) {
                FunctionDefinition function = builtin.get();
                if (!function.acceptsArity(args.size())) {
                    throw new FormulaEvaluationException(function.arityMismatch(args.size()));
                }
                return normalize(function.implementation().apply(args));
            }

            FormulaFunction extra = extraFunctions.get(node.name());
            if (extra == null) {
                throw new FormulaEvaluationException("Unknown function: '" + node.name() + "'");
            }
            try {
                return normalize(extra.apply(args));
            } catch (FormulaEvaluationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FormulaEvaluationException(
                        "Function '" + node.name() + "' failed: " + e.getMessage(), e);
            }
        }

        private static Number requireNumber(String symbol, Object value) {
            if (value instanceof Number n) {
                return Values.normalize(n);
            }
            throw new FormulaEvaluationException(
                    "Unsupported operand type for '" + symbol + "': " + Values.typeName(value));
        }

        private static Object normalize(Object value) {
            return value instanceof Number n ? Values.normalize(n) : value;
        }
    }
}
