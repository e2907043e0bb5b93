package db.pesa.query;

import java.util.List;

import db.pesa.expr.ColumnRef;
import db.pesa.expr.Expression;

/**
 * Logical SELECT query representation.
 * items: empty list means SELECT *. join, where, having, limit: null when absent.
 */
public record SelectQuery(boolean distinct, List<SelectItem> items, String table, JoinSpec join,
                          Expression where, List<ColumnRef> groupBy, Expression having,
                          List<OrderItem> orderBy, Long limit, Long offset) implements Query {

    public SelectQuery {
        items = List.copyOf(items);
        groupBy = List.copyOf(groupBy);
        orderBy = List.copyOf(orderBy);
    }

    public boolean isStar() { return items.isEmpty(); }

    @Override public Category category() { return Category.DQL; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitSelect(this, context); }
}
