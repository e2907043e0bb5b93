package db.pesa.expr;

public enum AggregateFunction {
    COUNT, SUM, AVG, MIN, MAX;
}
