package db.pesa.query;

public record DescribeQuery(String table) implements Query {
    @Override public Category category() { return Category.DDL; }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitDescribe(this, context); }
}
