package db.pesa.error;

public class PersistenceException extends DbException {
    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_FAILURE, message, cause);
    }
}
