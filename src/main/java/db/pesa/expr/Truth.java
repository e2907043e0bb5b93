package db.pesa.expr;

/** Three-valued logic result. UNKNOWN filters like FALSE. */
public enum Truth {
    TRUE, FALSE, UNKNOWN;

    public static Truth of(boolean b) { return b ? TRUE : FALSE; }

    public Truth not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public boolean isTrue() { return this == TRUE; }
}
