package db.pesa.error;

/** Non-aggregate column projected next to an aggregate without a matching GROUP BY entry. */
public class AmbiguousAggregationException extends DbException {
    public AmbiguousAggregationException(String message) {
        super(ErrorKind.AMBIGUOUS_AGGREGATION, message);
    }
}
