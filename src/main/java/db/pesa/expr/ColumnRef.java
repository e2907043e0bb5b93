package db.pesa.expr;

/** Column reference, optionally qualified by table name (table may be null). */
public record ColumnRef(String table, String column) implements Expression {

    public static ColumnRef of(String column) { return new ColumnRef(null, column); }

    public boolean isQualified() { return table != null; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitColumn(this, context); }

    @Override
    public String toString() { return table == null ? column : table + "." + column; }
}
