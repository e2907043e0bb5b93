package db.pesa.exec;

/**
 * Minimal predicate interface evaluated against a Row. UNKNOWN tests as false.
 */
public interface Predicate {
    boolean test(Row row);
}
