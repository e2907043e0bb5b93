package db.pesa.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.pesa.catalog.TableSchema;

/**
 * Outcome of one statement: result rows (SELECT), an affected-row count (INSERT, UPDATE, DELETE
 * and DDL) or a descriptor (SHOW, DESCRIBE).
 */
public final class QueryResult {
    public enum Kind { ROWS, AFFECTED_ROWS, DESCRIPTION }

    private final Kind kind;
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final long affectedRows;
    private final String message;
    private final TableSchema tableSchema; // DESCRIBE only

    private QueryResult(Kind kind, List<String> columns, List<List<Object>> rows, long affectedRows,
                        String message, TableSchema tableSchema) {
        this.kind = kind;
        this.columns = List.copyOf(columns);
        this.rows = rows;
        this.affectedRows = affectedRows;
        this.message = message;
        this.tableSchema = tableSchema;
    }

    public static QueryResult rows(List<String> columns, List<List<Object>> rows) {
        return new QueryResult(Kind.ROWS, columns, rows, 0, rows.size() + " row(s)", null);
    }

    public static QueryResult affected(long count, String message) {
        return new QueryResult(Kind.AFFECTED_ROWS, List.of(), List.of(), count, message, null);
    }

    public static QueryResult description(List<String> columns, List<List<Object>> rows, TableSchema tableSchema) {
        return new QueryResult(Kind.DESCRIPTION, columns, rows, 0, rows.size() + " row(s)", tableSchema);
    }

    public Kind kind() { return kind; }
    public List<String> columns() { return columns; }
    /** Positional rows; values are Long, Double, String, Boolean or null. */
    public List<List<Object>> rows() { return rows; }
    public long affectedRows() { return affectedRows; }
    public String message() { return message; }
    public TableSchema tableSchema() { return tableSchema; }

    /** Rows as ordered column-name to value maps. A repeated output name keeps its last value. */
    public List<Map<String, Object>> rowMaps() {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) m.put(columns.get(i), row.get(i));
            out.add(m);
        }
        return out;
    }

    /** Values of one output column, in row order. */
    public List<Object> column(String name) {
        int i = columns.indexOf(name);
        if (i < 0) throw new IllegalArgumentException("No result column '" + name + "' in " + columns);
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) out.add(row.get(i));
        return out;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case AFFECTED_ROWS -> "QueryResult(" + message + ")";
            case ROWS, DESCRIPTION -> "QueryResult" + columns + " " + rows;
        };
    }
}
