package db.pesa.query;

public record CreateDatabaseQuery(String name) implements Query {
    @Override public Category category() { return Category.DDL; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitCreateDatabase(this, context); }
}
