package db.pesa.query;

import java.util.List;

import db.pesa.expr.Expression;

/** Logical representation of UPDATE. where: null => every row. */
public record UpdateQuery(String table, List<Assignment> assignments, Expression where) implements Query {
    public UpdateQuery {
        if (assignments == null || assignments.isEmpty()) throw new IllegalArgumentException("assignments required");
        assignments = List.copyOf(assignments);
    }

    @Override public Category category() { return Category.DML; }
    @Override public boolean mutatesTables() { return true; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitUpdate(this, context); }
}
