package db.pesa.expr;

public record And(Expression left, Expression right) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitAnd(this, context); }

    @Override
    public String toString() { return "(" + left + " AND " + right + ")"; }
}
