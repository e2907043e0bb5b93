package db.pesa.query;

import db.pesa.expr.Expression;

// ORDER BY key: a column, alias or aggregate.
public record OrderItem(Expression expression, boolean descending) {}
