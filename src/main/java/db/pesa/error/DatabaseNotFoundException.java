package db.pesa.error;

/** Unknown database name, or no database selected in the session. */
public class DatabaseNotFoundException extends DbException {
    public DatabaseNotFoundException(String message) {
        super(ErrorKind.DATABASE_NOT_FOUND, message);
    }
}
