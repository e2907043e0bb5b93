package db.pesa.expr;

public record Or(Expression left, Expression right) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitOr(this, context); }

    @Override
    public String toString() { return "(" + left + " OR " + right + ")"; }
}
