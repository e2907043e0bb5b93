package db.pesa.query;

import db.pesa.catalog.TableSchema;

/** CREATE TABLE [IF NOT EXISTS]; the schema is already validated by TableSchema. */
public record CreateTableQuery(TableSchema schema, boolean ifNotExists) implements Query {
    @Override public Category category() { return Category.DDL; }
    @Override public boolean mutatesTables() { return true; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitCreateTable(this, context); }
}
