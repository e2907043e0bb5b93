package db.pesa.expr;

public record Comparison(CompareOp op, Expression left, Expression right) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitComparison(this, context); }

    @Override
    public String toString() { return "(" + left + " " + op.symbol() + " " + right + ")"; }
}
