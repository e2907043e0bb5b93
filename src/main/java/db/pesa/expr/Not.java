package db.pesa.expr;

public record Not(Expression operand) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitNot(this, context); }

    @Override
    public String toString() { return "NOT " + operand; }
}
