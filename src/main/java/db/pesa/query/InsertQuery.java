package db.pesa.query;

import java.util.List;

/**
 * Logical representation of an INSERT statement.
 * columns: empty list means every column in schema order. Each row holds literal values.
 */
public record InsertQuery(String table, List<String> columns, List<List<Object>> rows) implements Query {
    public InsertQuery {
        if (table == null || table.isBlank()) throw new IllegalArgumentException("table required");
        if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("at least one row required");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean hasColumnList() { return !columns.isEmpty(); }

    @Override public Category category() { return Category.DML; }
    @Override public boolean mutatesTables() { return true; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitInsert(this, context); }
}
