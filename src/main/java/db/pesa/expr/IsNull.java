package db.pesa.expr;

public record IsNull(Expression operand, boolean negated) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitIsNull(this, context); }

    @Override
    public String toString() { return "(" + operand + (negated ? " IS NOT NULL)" : " IS NULL)"); }
}
