package db.pesa.expr;

import java.util.ArrayList;
import java.util.List;

/** Structural queries over expression trees used while planning. */
public final class Expressions {
    private Expressions() {}

    public static boolean containsAggregate(Expression e) {
        return !aggregates(e).isEmpty();
    }

    /** Aggregate calls in evaluation order, duplicates kept. */
    public static List<AggregateCall> aggregates(Expression e) {
        List<AggregateCall> calls = new ArrayList<>();
        for (Expression x : leaves(e)) if (x instanceof AggregateCall a) calls.add(a);
        return calls;
    }

    /** Column references outside aggregate calls. */
    public static List<ColumnRef> columns(Expression e) {
        List<ColumnRef> refs = new ArrayList<>();
        for (Expression x : leaves(e)) if (x instanceof ColumnRef c) refs.add(c);
        return refs;
    }

    private static List<Expression> leaves(Expression e) {
        List<Expression> out = new ArrayList<>();
        if (e != null) e.accept(new Collector(), out);
        return out;
    }

    /** Splits nested ANDs into their operands; any other node is a single conjunct. */
    public static List<Expression> conjuncts(Expression e) {
        List<Expression> out = new ArrayList<>();
        collectConjuncts(e, out);
        return out;
    }

    private static void collectConjuncts(Expression e, List<Expression> out) {
        if (e instanceof And and) {
            collectConjuncts(and.left(), out);
            collectConjuncts(and.right(), out);
        } else if (e != null) {
            out.add(e);
        }
    }

    // Collects leaves: AggregateCall and ColumnRef nodes. Callers filter by type.
    private static final class Collector implements Expression.Visitor<Void, List<Expression>> {
        @Override public Void visitLiteral(Literal node, List<Expression> out) { return null; }
        @Override public Void visitColumn(ColumnRef node, List<Expression> out) { out.add(node); return null; }
        @Override public Void visitComparison(Comparison node, List<Expression> out) { return both(node.left(), node.right(), out); }
        @Override public Void visitAnd(And node, List<Expression> out) { return both(node.left(), node.right(), out); }
        @Override public Void visitOr(Or node, List<Expression> out) { return both(node.left(), node.right(), out); }
        @Override public Void visitNot(Not node, List<Expression> out) { return node.operand().accept(this, out); }
        @Override public Void visitIsNull(IsNull node, List<Expression> out) { return node.operand().accept(this, out); }

        @Override
        public Void visitBetween(Between node, List<Expression> out) {
            node.operand().accept(this, out);
            return both(node.low(), node.high(), out);
        }

        @Override
        public Void visitIn(InList node, List<Expression> out) {
            node.operand().accept(this, out);
            for (Expression v : node.values()) v.accept(this, out);
            return null;
        }

        @Override public Void visitLike(Like node, List<Expression> out) { return node.operand().accept(this, out); }
        @Override public Void visitAggregate(AggregateCall node, List<Expression> out) { out.add(node); return null; }

        private Void both(Expression l, Expression r, List<Expression> out) {
            l.accept(this, out);
            r.accept(this, out);
            return null;
        }
    }
}
