package db.pesa.expr;

/**
 * COUNT(*), COUNT(col), SUM/AVG/MIN/MAX(col). A null argument means '*', which only COUNT accepts.
 * Outside a grouped query the node is resolved as a pseudo-column named by {@link #canonicalName()}.
 */
public record AggregateCall(AggregateFunction function, ColumnRef argument) implements Expression {

    public AggregateCall {
        if (argument == null && function != AggregateFunction.COUNT) {
            throw new IllegalArgumentException(function + " requires a column argument");
        }
    }

    public static AggregateCall countStar() { return new AggregateCall(AggregateFunction.COUNT, null); }

    public boolean isStar() { return argument == null; }

    public String canonicalName() {
        return function + "(" + (argument == null ? "*" : argument.toString()) + ")";
    }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitAggregate(this, context); }

    @Override
    public String toString() { return canonicalName(); }
}
