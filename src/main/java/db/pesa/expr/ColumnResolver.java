package db.pesa.expr;

/** Maps column references and aggregate pseudo-columns to value positions; throws when unknown. */
public interface ColumnResolver {
    int indexOf(ColumnRef ref);

    int indexOf(AggregateCall call);
}
