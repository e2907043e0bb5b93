package db.pesa.error;

public class ColumnNotFoundException extends DbException {
    public ColumnNotFoundException(String message) {
        super(ErrorKind.COLUMN_NOT_FOUND, message);
    }
}
