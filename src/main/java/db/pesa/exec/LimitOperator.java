package db.pesa.exec;

/**
 * Skips the first offset rows, then passes at most limit rows (no limit when null).
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final long offset;
    private final Long limit;
    private long skipped;
    private long emitted;

    public LimitOperator(Operator child, long offset, Long limit) {
        if (offset < 0 || (limit != null && limit < 0)) {
            throw new IllegalArgumentException("LIMIT and OFFSET must not be negative");
        }
        this.child = child;
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public void open() {
        child.open();
        skipped = 0;
        emitted = 0;
    }

    @Override
    public Row next() {
        if (limit != null && emitted >= limit) return null;
        Row r;
        while ((r = child.next()) != null) {
            if (skipped < offset) {
                skipped++;
                continue;
            }
            emitted++;
            return r;
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return child.schema(); }
}
