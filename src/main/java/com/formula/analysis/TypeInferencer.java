package com.formula.analysis;

import com.formula.ast.BinaryOp;
import com.formula.ast.BooleanLiteral;
import com.formula.ast.Comparison;
import com.formula.ast.Expression;
import com.formula.ast.ExpressionVisitor;
import com.formula.ast.FieldReference;
import com.formula.ast.FunctionCall;
import com.formula.ast.LogicalOp;
import com.formula.ast.NullLiteral;
import com.formula.ast.NumberLiteral;
import com.formula.ast.StringLiteral;
import com.formula.ast.UnaryOp;
import com.formula.ast.UnaryOperator;
import com.formula.function.FunctionDefinition;
import com.formula.function.FunctionRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Infers the static result type of a formula against a field snapshot.
 * <p>
 * Operand mismatches never fail: the affected node becomes UNKNOWN and a warning
 * is recorded. Unknown fields and functions infer as UNKNOWN silently; reporting
 * them is the validator's job.
 */
public class TypeInferencer {

    private final Map<String, FieldInfo> fields;

    /**
     * @param fields Field snapshot keyed by field id
     */
    public TypeInferencer(Map<String, FieldInfo> fields) {
        this.fields = Map.copyOf(fields);
    }

    public TypeInference infer(Expression expression) {
        Pass pass = new Pass();
        ResultType type = expression.accept(pass);
        return new TypeInference(type, new ArrayList<>(new LinkedHashSet<>(pass.warnings)));
    }

    private final class Pass implements ExpressionVisitor<ResultType> {

        private final List<String> warnings = new ArrayList<>();

        @Override
        public ResultType visitNumber(NumberLiteral node) {
            return ResultType.NUMBER;
        }

        @Override
        public ResultType visitString(StringLiteral node) {
            return ResultType.TEXT;
        }

        @Override
        public ResultType visitBoolean(BooleanLiteral node) {
            return ResultType.BOOLEAN;
        }

        @Override
        public ResultType visitNull(NullLiteral node) {
            return ResultType.UNKNOWN;
        }

        @Override
        public ResultType visitFieldReference(FieldReference node) {
            FieldInfo field = fields.get(node.fieldId());
            return field != null ? field.resultType() : ResultType.UNKNOWN;
        }

        @Override
        public ResultType visitUnary(UnaryOp node) {
            ResultType operand = node.operand().accept(this);
            if (node.operator() == UnaryOperator.NOT) {
                return ResultType.BOOLEAN;
            }
            return arithmetic(node.operator().symbol(), operand);
        }

        @Override
        public ResultType visitBinary(BinaryOp node) {
            ResultType left = node.left().accept(this);
            ResultType right = node.right().accept(this);
            return arithmetic(node.operator().symbol(), left, right);
        }

        @Override
        public ResultType visitLogical(LogicalOp node) {
            node.left().accept(this);
            node.right().accept(this);
            return ResultType.BOOLEAN;
        }

        @Override
        public ResultType visitComparison(Comparison node) {
            node.left().accept(this);
            node.right().accept(this);
            return ResultType.BOOLEAN;
        }

        @Override
        public ResultType visitFunctionCall(FunctionCall node) {
            List<ResultType> argumentTypes = new ArrayList<>();
            for (Expression argument : node.arguments()) {
                argumentTypes.add(argument.accept(this));
            }

            Optional<FunctionDefinition> definition = FunctionRegistry.find(node.name());
            if (definition.isEmpty()) {
                return ResultType.UNKNOWN;
            }
            FunctionDefinition function = definition.get();
            if (!function.acceptsArity(argumentTypes.size())) {
                warnings.add(function.arityMismatch(argumentTypes.size()));
                return ResultType.UNKNOWN;
            }
            return function.returnTypeRule().resolve(function.name(), argumentTypes, warnings);
        }

        private ResultType arithmetic(String symbol, ResultType... operands) {
            ResultType result = ResultType.NUMBER;
            for (ResultType operand : operands) {
                if (operand == ResultType.TEXT || operand == ResultType.BOOLEAN) {
                    warnings.add("Arithmetic operation '" + symbol + "' on " + operand + " operand may fail");
                    result = ResultType.UNKNOWN;
                }
            }
            return result;
        }
    }
}
