package db.pesa.expr;

import java.util.List;
import java.util.stream.Collectors;

public record InList(Expression operand, List<Expression> values, boolean negated) implements Expression {
    public InList {
        values = List.copyOf(values);
    }

    @Override
    public <R, C> R accept(Visitor<R, C> visitor, C context) { return visitor.visitIn(this, context); }

    @Override
    public String toString() {
        String list = values.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return "(" + operand + (negated ? " NOT" : "") + " IN (" + list + "))";
    }
}
