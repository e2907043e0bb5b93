package db.pesa.catalog;

// Target of a REFERENCES clause.
public record ForeignKey(String table, String column) {
    @Override
    public String toString() { return table + "(" + column + ")"; }
}
