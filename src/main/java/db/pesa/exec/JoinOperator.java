package db.pesa.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Nested loop INNER JOIN. The right side is materialized on open(); every left row is paired
 * with every right row and the pair is kept when the ON predicate holds. Left rows without a
 * match produce nothing.
 * The ON predicate is evaluated against {@link #schema()} (left columns, then right columns).
 */
public class JoinOperator implements Operator {
    private final Operator left;
    private final Operator right;
    private final Predicate on;
    private final RowSchema joinedSchema;

    private List<Row> rightRows;
    private Row currentLeft;
    private int rightIndex;

    public JoinOperator(Operator left, Operator right, Predicate on) {
        this.left = left;
        this.right = right;
        this.on = on;
        this.joinedSchema = left.schema().concat(right.schema());
    }

    @Override
    public void open() {
        left.open();
        right.open();
        rightRows = new ArrayList<>();
        Row r;
        while ((r = right.next()) != null) rightRows.add(r);
        right.close(); // no longer needed
        currentLeft = left.next();
        rightIndex = 0;
    }

    @Override
    public Row next() {
        while (currentLeft != null) {
            while (rightIndex < rightRows.size()) {
                Row candidate = currentLeft.concat(rightRows.get(rightIndex++));
                if (on.test(candidate)) return candidate;
            }
            currentLeft = left.next();
            rightIndex = 0;
        }
        return null;
    }

    @Override
    public void close() {
        left.close();
        rightRows = null;
        currentLeft = null;
    }

    @Override
    public RowSchema schema() { return joinedSchema; }
}
