package db.pesa.error;

public class TableNotFoundException extends DbException {
    public TableNotFoundException(String message) {
        super(ErrorKind.TABLE_NOT_FOUND, message);
    }
}
