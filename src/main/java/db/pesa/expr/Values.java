package db.pesa.expr;

import db.pesa.catalog.DataType;
import db.pesa.error.TypeMismatchException;

/**
 * Comparison rules shared by the evaluator, aggregates and ORDER BY.
 * INT and FLOAT compare numerically; STRING and BOOL only compare with their own type.
 */
public final class Values {
    private Values() {}

    /** True when both values can be ordered against each other. */
    public static boolean comparable(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) return true;
        if (a instanceof String && b instanceof String) return true;
        return a instanceof Boolean && b instanceof Boolean;
    }

    /** Orders two non-NULL values of compatible types; throws TypeMismatch otherwise. */
    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if ((x instanceof Long || x instanceof Integer) && (y instanceof Long || y instanceof Integer)) {
                return Long.compare(x.longValue(), y.longValue());
            }
            double dx = x.doubleValue();
            double dy = y.doubleValue();
            return dx == dy ? 0 : Double.compare(dx, dy);
        }
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        if (a instanceof Boolean x && b instanceof Boolean y) return Boolean.compare(x, y);
        throw new TypeMismatchException("Cannot compare " + describe(a) + " with " + describe(b));
    }

    /** Applies a comparison operator under three-valued logic. */
    public static Truth compare(CompareOp op, Object a, Object b) {
        if (a == null || b == null) return Truth.UNKNOWN;
        if (!comparable(a, b)) {
            return switch (op) {
                case EQ -> Truth.FALSE;
                case NE -> Truth.TRUE;
                default -> throw new TypeMismatchException("Operator " + op.symbol() + " cannot compare "
                    + describe(a) + " with " + describe(b));
            };
        }
        int c = compare(a, b);
        return Truth.of(switch (op) {
            case EQ -> c == 0;
            case NE -> c != 0;
            case LT -> c < 0;
            case LTE -> c <= 0;
            case GT -> c > 0;
            case GTE -> c >= 0;
        });
    }

    public static String describe(Object v) {
        if (v == null) return "NULL";
        DataType t = DataType.of(v);
        return t == DataType.STRING ? t + " '" + v + "'" : t + " " + v;
    }
}
