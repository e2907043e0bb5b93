package db.pesa.catalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import db.pesa.error.InvalidSchemaException;

// Immutable data carrier for a table schema. Validated on construction.
public record TableSchema(String name, List<ColumnSchema> columns) {

    public TableSchema {
        if (name == null || name.isBlank()) throw new InvalidSchemaException("Table name required");
        if (columns == null || columns.isEmpty()) {
            throw new InvalidSchemaException("Table '" + name + "' must have at least one column");
        }
        Set<String> seen = new HashSet<>();
        int primaryKeys = 0;
        for (ColumnSchema c : columns) {
            if (!seen.add(c.name())) {
                throw new InvalidSchemaException("Duplicate column name '" + c.name() + "' in table '" + name + "'");
            }
            if (c.primaryKey()) primaryKeys++;
        }
        if (primaryKeys == 0) throw new InvalidSchemaException("Table '" + name + "' must have exactly one PRIMARY KEY column");
        if (primaryKeys > 1) throw new InvalidSchemaException("Table '" + name + "' can have only one PRIMARY KEY column");
        columns = List.copyOf(columns);
    }

    /** Position of the column, or -1. */
    public int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) return i;
        }
        return -1;
    }

    public ColumnSchema column(String columnName) {
        int i = columnIndex(columnName);
        return i < 0 ? null : columns.get(i);
    }

    public ColumnSchema primaryKey() {
        for (ColumnSchema c : columns) if (c.primaryKey()) return c;
        throw new IllegalStateException("unreachable: schema without primary key");
    }

    public List<String> columnNames() {
        List<String> out = new ArrayList<>(columns.size());
        for (ColumnSchema c : columns) out.add(c.name());
        return out;
    }
}
