package db.pesa.query;

import db.pesa.expr.Expression;

/** Logical representation of DELETE statement. */
public record DeleteQuery(String table, Expression where) implements Query {
    public DeleteQuery {
        if (table == null || table.isBlank()) throw new IllegalArgumentException("table required");
    }

    public boolean hasWhere() { return where != null; }

    @Override public Category category() { return Category.DML; }
    @Override public boolean mutatesTables() { return true; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitDelete(this, context); }
}
