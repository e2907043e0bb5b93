package db.pesa.query;

import db.pesa.exec.Predicate;
import db.pesa.exec.RowSchema;
import db.pesa.expr.Expression;
import db.pesa.expr.ExpressionEvaluator;

/**
 * Compiles a logical condition into a physical Predicate bound to a row layout.
 * Column references are resolved here, so unknown columns fail at plan time even over
 * empty tables. Returns null if there is no condition.
 */
public class PredicateCompiler {

    public Predicate compile(Expression condition, RowSchema schema) {
        if (condition == null) return null;
        ExpressionEvaluator evaluator = new ExpressionEvaluator(schema);
        Expression bound = evaluator.bind(condition);
        return row -> evaluator.test(bound, row.values()).isTrue();
    }
}
