package db.pesa.catalog;

import java.util.Locale;

import db.pesa.error.TypeMismatchException;

/**
 * Supported primitive column data types.
 * INT values are held as Long, FLOAT as Double.
 */
public enum DataType {
    INT,
    FLOAT,
    STRING,
    BOOL;

    public static DataType fromKeyword(String keyword) {
        return switch (keyword.toUpperCase(Locale.ROOT)) {
            case "INT", "INTEGER" -> INT;
            case "FLOAT", "DOUBLE" -> FLOAT;
            case "STRING", "TEXT", "VARCHAR" -> STRING;
            case "BOOL", "BOOLEAN" -> BOOL;
            default -> throw new IllegalArgumentException("Unsupported data type: " + keyword);
        };
    }

    /**
     * Checks a value against this type and normalizes it (Integer to Long, INT into FLOAT widens).
     * NULL passes through untouched.
     */
    public Object coerce(Object value, String columnName) {
        if (value == null) return null;
        switch (this) {
            case INT -> {
                if (value instanceof Long || value instanceof Integer || value instanceof Short) {
                    return ((Number) value).longValue();
                }
            }
            case FLOAT -> {
                if (value instanceof Number n) return normalize(n.doubleValue());
            }
            case STRING -> {
                if (value instanceof String) return value;
            }
            case BOOL -> {
                if (value instanceof Boolean) return value;
            }
        }
        throw new TypeMismatchException("Column '" + columnName + "' expects " + this + ", got "
            + describe(value));
    }

    /** Folds -0.0 into 0.0 so equal FLOAT values are also equal as index and group keys. */
    public static double normalize(double d) {
        return d == 0.0 ? 0.0 : d;
    }

    public boolean isNumeric() { return this == INT || this == FLOAT; }

    /** Type of a runtime value, or null for NULL. */
    public static DataType of(Object value) {
        if (value == null) return null;
        if (value instanceof Long || value instanceof Integer) return INT;
        if (value instanceof Double || value instanceof Float) return FLOAT;
        if (value instanceof String) return STRING;
        if (value instanceof Boolean) return BOOL;
        throw new TypeMismatchException("Unsupported value type: " + value.getClass().getSimpleName());
    }

    private static String describe(Object v) {
        DataType t;
        try {
            t = of(v);
        } catch (TypeMismatchException e) {
            return v.getClass().getSimpleName();
        }
        return t + " '" + v + "'";
    }
}
