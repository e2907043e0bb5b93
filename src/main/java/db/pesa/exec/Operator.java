package db.pesa.exec;

/**
 * Minimal physical operator interface (Volcano style pull).
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /** Layout of the rows this operator produces. Available before open(). */
    RowSchema schema();
}
