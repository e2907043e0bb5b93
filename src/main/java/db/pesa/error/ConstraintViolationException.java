package db.pesa.error;

/** PRIMARY KEY / UNIQUE duplicate or a referential-integrity block. */
public class ConstraintViolationException extends DbException {
    public ConstraintViolationException(String message) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message);
    }
}
