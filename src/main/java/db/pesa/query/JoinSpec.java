package db.pesa.query;

import db.pesa.expr.Expression;

/**
 * Logical INNER JOIN: left table is SelectQuery.table, right table and ON condition defined here.
 */
public record JoinSpec(String table, Expression on) {}
