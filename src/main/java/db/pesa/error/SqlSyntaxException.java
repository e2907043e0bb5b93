package db.pesa.error;

/**
 * Lexical or grammar failure. Carries the offending lexeme and its character position.
 */
public class SqlSyntaxException extends DbException {
    private final String offending;
    private final int position;

    public SqlSyntaxException(String message, String offending, int position) {
        super(ErrorKind.SYNTAX_ERROR, message + " at position " + position);
        this.offending = offending;
        this.position = position;
    }

    public String offending() { return offending; }
    public int position() { return position; }
}
