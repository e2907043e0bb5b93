package db.pesa.error;

/**
 * Base class for every failure the engine reports. Callers switch on {@link #kind()}
 * rather than on the concrete subclass.
 */
public class DbException extends RuntimeException {
    private final ErrorKind kind;

    public DbException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DbException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    @Override
    public String toString() { return kind + ": " + getMessage(); }
}
