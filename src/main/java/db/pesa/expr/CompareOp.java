package db.pesa.expr;

public enum CompareOp {
    EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

    private final String symbol;

    CompareOp(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    public static CompareOp fromSymbol(String s) {
        return switch (s) {
            case "=" -> EQ;
            case "!=", "<>" -> NE;
            case "<" -> LT;
            case "<=" -> LTE;
            case ">" -> GT;
            case ">=" -> GTE;
            default -> throw new IllegalArgumentException("Unsupported operator: " + s);
        };
    }
}
