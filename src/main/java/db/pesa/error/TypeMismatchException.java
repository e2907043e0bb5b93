package db.pesa.error;

/** A value does not conform to the declared column type or cannot be compared. */
public class TypeMismatchException extends DbException {
    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }
}
