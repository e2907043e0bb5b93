package db.pesa.error;

public class DuplicateObjectException extends DbException {
    public DuplicateObjectException(String message) {
        super(ErrorKind.DUPLICATE_OBJECT, message);
    }
}
