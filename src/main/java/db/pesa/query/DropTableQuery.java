package db.pesa.query;

public record DropTableQuery(String name, boolean ifExists) implements Query {
    @Override public Category category() { return Category.DDL; }
    @Override public boolean mutatesTables() { return true; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitDropTable(this, context); }
}
