package db.pesa.expr;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import db.pesa.error.TypeMismatchException;

/**
 * Evaluates expressions against positional row values under three-valued logic.
 * <p>
 * Column positions are resolved once by {@link #bind(Expression)}, so an unknown column fails
 * before any row is read. AND/OR stop as soon as the left operand decides the result.
 */
public class ExpressionEvaluator {
    private final ColumnResolver resolver;
    private final Map<Expression, Integer> positions = new HashMap<>();
    private final ValueVisitor values = new ValueVisitor();

    public ExpressionEvaluator(ColumnResolver resolver) {
        this.resolver = resolver;
    }

    /** Resolves every column and aggregate in the tree; returns the expression for chaining. */
    public Expression bind(Expression e) {
        for (ColumnRef ref : Expressions.columns(e)) positions.computeIfAbsent(ref, k -> resolver.indexOf(ref));
        for (AggregateCall call : Expressions.aggregates(e)) positions.computeIfAbsent(call, k -> resolver.indexOf(call));
        return e;
    }

    /** Value of an expression; predicate nodes yield Boolean, or null when UNKNOWN. */
    public Object evaluate(Expression e, List<Object> row) {
        return e.accept(values, row);
    }

    public Truth test(Expression e, List<Object> row) {
        return truth(e, evaluate(e, row));
    }

    private Truth truth(Expression source, Object v) {
        if (v == null) return Truth.UNKNOWN;
        if (v instanceof Boolean b) return Truth.of(b);
        throw new TypeMismatchException("Expression " + source + " is not a boolean condition (got "
            + Values.describe(v) + ")");
    }

    private static Boolean bool(Truth t) {
        return t == Truth.UNKNOWN ? null : t == Truth.TRUE;
    }

    private int position(Expression leaf) {
        Integer i = positions.get(leaf);
        if (i == null) {
            bind(leaf);
            i = positions.get(leaf);
        }
        return i;
    }

    private final class ValueVisitor implements Expression.Visitor<Object, List<Object>> {
        @Override
        public Object visitLiteral(Literal node, List<Object> row) { return node.value(); }

        @Override
        public Object visitColumn(ColumnRef node, List<Object> row) { return row.get(position(node)); }

        @Override
        public Object visitAggregate(AggregateCall node, List<Object> row) { return row.get(position(node)); }

        @Override
        public Object visitComparison(Comparison node, List<Object> row) {
            return bool(Values.compare(node.op(), node.left().accept(this, row), node.right().accept(this, row)));
        }

        @Override
        public Object visitAnd(And node, List<Object> row) {
            Truth left = test(node.left(), row);
            if (left == Truth.FALSE) return Boolean.FALSE;
            Truth right = test(node.right(), row);
            if (right == Truth.FALSE) return Boolean.FALSE;
            return left == Truth.TRUE && right == Truth.TRUE ? Boolean.TRUE : null;
        }

        @Override
        public Object visitOr(Or node, List<Object> row) {
            Truth left = test(node.left(), row);
            if (left == Truth.TRUE) return Boolean.TRUE;
            Truth right = test(node.right(), row);
            if (right == Truth.TRUE) return Boolean.TRUE;
            return left == Truth.FALSE && right == Truth.FALSE ? Boolean.FALSE : null;
        }

        @Override
        public Object visitNot(Not node, List<Object> row) {
            return bool(test(node.operand(), row).not());
        }

        @Override
        public Object visitIsNull(IsNull node, List<Object> row) {
            boolean isNull = node.operand().accept(this, row) == null;
            return isNull != node.negated();
        }

        @Override
        public Object visitBetween(Between node, List<Object> row) {
            Object v = node.operand().accept(this, row);
            Truth low = Values.compare(CompareOp.GTE, v, node.low().accept(this, row));
            Truth result;
            if (low == Truth.FALSE) {
                result = Truth.FALSE;
            } else {
                Truth high = Values.compare(CompareOp.LTE, v, node.high().accept(this, row));
                if (high == Truth.FALSE) result = Truth.FALSE;
                else result = low == Truth.TRUE && high == Truth.TRUE ? Truth.TRUE : Truth.UNKNOWN;
            }
            return bool(node.negated() ? result.not() : result);
        }

        // NULL never matches, not even NULL IN (NULL)
        @Override
        public Object visitIn(InList node, List<Object> row) {
            Object v = node.operand().accept(this, row);
            if (v == null) return null;
            boolean sawNull = false;
            for (Expression candidate : node.values()) {
                Object c = candidate.accept(this, row);
                if (c == null) {
                    sawNull = true;
                    continue;
                }
                if (Values.compare(CompareOp.EQ, v, c) == Truth.TRUE) return !node.negated();
            }
            if (sawNull) return null;
            return node.negated();
        }

        @Override
        public Object visitLike(Like node, List<Object> row) {
            Object v = node.operand().accept(this, row);
            if (v == null) return null;
            String text = v instanceof String s ? s : String.valueOf(v);
            return node.pattern().matches(text) != node.negated();
        }
    }
}
