package com.formula.ast;

/**
 * Visitor over the closed set of formula nodes.
 *
 * @param <R> Result type of the pass
 */
public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitString(StringLiteral node);

    R visitBoolean(BooleanLiteral node);

    R visitNull(NullLiteral node);

    R visitFieldReference(FieldReference node);

    R visitUnary(UnaryOp node);

    R visitBinary(BinaryOp node);

    R visitLogical(LogicalOp node);

    R visitComparison(Comparison node);

    R visitFunctionCall(FunctionCall node);
}
