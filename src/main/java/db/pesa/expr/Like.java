package db.pesa.expr;

public record Like(Expression operand, LikePattern pattern, boolean negated) implements Expression {
    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitLike(this, context); }

    @Override
    public String toString() { return "(" + operand + (negated ? " NOT" : "") + " LIKE " + pattern + ")"; }
}
