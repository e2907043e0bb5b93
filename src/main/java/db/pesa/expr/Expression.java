package db.pesa.expr;

/**
 * Immutable expression tree produced by the parser. Consumers dispatch through {@link Visitor},
 * so adding a node kind breaks every consumer until it handles the new kind.
 */
public sealed interface Expression
    permits Literal, ColumnRef, Comparison, And, Or, Not, IsNull, Between, InList, Like, AggregateCall {

    <R, C> R accept(Visitor<R, C> visitor, C context);

    interface Visitor<R, C> {
        R visitLiteral(Literal node, C context);
        R visitColumn(ColumnRef node, C context);
        R visitComparison(Comparison node, C context);
        R visitAnd(And node, C context);
        R visitOr(Or node, C context);
        R visitNot(Not node, C context);
        R visitIsNull(IsNull node, C context);
        R visitBetween(Between node, C context);
        R visitIn(InList node, C context);
        R visitLike(Like node, C context);
        R visitAggregate(AggregateCall node, C context);
    }
}
