package db.pesa.expr;

/** operand [NOT] BETWEEN low AND high, inclusive on both bounds. */
public record Between(Expression operand, Expression low, Expression high, boolean negated) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitBetween(this, context); }

    @Override
    public String toString() {
        return "(" + operand + (negated ? " NOT" : "") + " BETWEEN " + low + " AND " + high + ")";
    }
}
