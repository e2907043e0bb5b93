package db.pesa.catalog;

// Immutable data carrier for a table column.
// references: null unless the column was declared with REFERENCES.
public record ColumnSchema(String name, DataType type, boolean primaryKey, boolean unique, ForeignKey references) {

    public static ColumnSchema of(String name, DataType type) {
        return new ColumnSchema(name, type, false, false, null);
    }

    public static ColumnSchema primaryKey(String name, DataType type) {
        return new ColumnSchema(name, type, true, false, null);
    }

    /** PRIMARY KEY and UNIQUE columns reject duplicate non-NULL values. */
    public boolean uniqueKey() { return primaryKey || unique; }

    /** Columns that get an automatically maintained hash index. */
    public boolean indexed() { return primaryKey || unique || references != null; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type);
        if (primaryKey) sb.append(" PRIMARY KEY");
        if (unique) sb.append(" UNIQUE");
        if (references != null) sb.append(" REFERENCES ").append(references);
        return sb.toString();
    }
}
