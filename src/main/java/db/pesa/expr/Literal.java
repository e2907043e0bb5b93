package db.pesa.expr;

/** Constant: Long, Double, String, Boolean or NULL. */
public record Literal(Object value) implements Expression {
    public static final Literal NULL = new Literal(null);

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitLiteral(this, context); }

    @Override
    public String toString() {
        if (value == null) return "NULL";
        if (value instanceof String s) return "'" + s.replace("'", "''") + "'";
        if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
        return String.valueOf(value);
    }
}
