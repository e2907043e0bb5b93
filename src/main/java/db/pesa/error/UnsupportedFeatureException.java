package db.pesa.error;

public class UnsupportedFeatureException extends DbException {
    public UnsupportedFeatureException(String message) {
        super(ErrorKind.UNSUPPORTED_FEATURE, message);
    }
}
