package db.pesa.error;

public class InvalidSchemaException extends DbException {
    public InvalidSchemaException(String message) {
        super(ErrorKind.INVALID_SCHEMA, message);
    }
}
