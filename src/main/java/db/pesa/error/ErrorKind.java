package db.pesa.error;

/**
 * Stable error categories reported at the command boundary.
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    DATABASE_NOT_FOUND,
    TABLE_NOT_FOUND,
    COLUMN_NOT_FOUND,
    TYPE_MISMATCH,
    CONSTRAINT_VIOLATION,
    AMBIGUOUS_AGGREGATION,
    UNSUPPORTED_FEATURE,
    DUPLICATE_OBJECT,
    INVALID_SCHEMA,
    PERSISTENCE_FAILURE,
    INTERNAL_ERROR;
}
