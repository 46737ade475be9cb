package com.formula.ast;

/**
 * Node of a parsed formula.
 * <p>
 * The hierarchy is closed: every pass over a formula (type inference, reference
 * extraction, execution) is an {@link ExpressionVisitor} and therefore has to handle
 * each node kind. Nodes are immutable once built.
 */
public sealed interface Expression
        permits NumberLiteral, StringLiteral, BooleanLiteral, NullLiteral, FieldReference,
        UnaryOp, BinaryOp, LogicalOp, Comparison, FunctionCall {

    <R> R accept(ExpressionVisitor<R> visitor);
}
