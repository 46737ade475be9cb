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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the names a formula refers to.
 */
public final class ReferenceExtractor {

    private ReferenceExtractor() {
    }

    /**
     * Field ids referenced by the expression. Function names and literals are excluded.
     *
     * @return Sorted, unmodifiable set of field ids
     */
    public static SortedSet<String> fieldReferences(Expression expression) {
        Collector collector = new Collector();
        expression.accept(collector);
        return Collections.unmodifiableSortedSet(collector.fields);
    }

    /**
     * Names of every function called by the expression.
     *
     * @return Sorted, unmodifiable set of function names
     */
    public static SortedSet<String> functionNames(Expression expression) {
        Collector collector = new Collector();
        expression.accept(collector);
        return Collections.unmodifiableSortedSet(collector.functions);
    }

    private static final class Collector implements ExpressionVisitor<Void> {

        private final SortedSet<String> fields = new TreeSet<>();
        private final SortedSet<String> functions = new TreeSet<>();

        @Override
        public Void visitNumber(NumberLiteral node) {
            return null;
        }

        @Override
        public Void visitString(StringLiteral node) {
            return null;
        }

        @Override
        public Void visitBoolean(BooleanLiteral node) {
            return null;
        }

        @Override
        public Void visitNull(NullLiteral node) {
            return null;
        }

        @Override
        public Void visitFieldReference(FieldReference node) {
            fields.add(node.fieldId());
            return null;
        }

        @Override
        public Void visitUnary(UnaryOp node) {
            node.operand().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(BinaryOp node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitLogical(LogicalOp node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitComparison(Comparison node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall node) {
            functions.add(node.name());
            for (Expression argument : node.arguments()) {
                argument.accept(this);
            }
            return null;
        }
    }
}
