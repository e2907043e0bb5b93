package db.pesa.query;

import db.pesa.expr.AggregateCall;
import db.pesa.expr.ColumnRef;
import db.pesa.expr.Expression;

/** One entry of the select list: a column or aggregate with an optional alias. */
public record SelectItem(Expression expression, String alias) {
    public SelectItem {
        if (!(expression instanceof ColumnRef) && !(expression instanceof AggregateCall)) {
            throw new IllegalArgumentException("select item must be a column or aggregate: " + expression);
        }
    }

    public boolean isAggregate() { return expression instanceof AggregateCall; }

    /** Key of this item in result rows: alias, else the text as written. */
    public String outputName() { return alias != null ? alias : expression.toString(); }
}
