package db.pesa.exec;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops rows whose values equal an earlier row's, keeping first occurrences in order.
 */
public class DistinctOperator implements Operator {
    private final Operator child;
    private Set<List<Object>> seen;

    public DistinctOperator(Operator child) {
        this.child = child;
    }

    @Override
    public void open() {
        child.open();
        seen = new HashSet<>();
    }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            if (seen.add(r.values())) return r;
        }
        return null;
    }

    @Override
    public void close() {
        child.close();
        seen = null;
    }

    @Override
    public RowSchema schema() { return child.schema(); }
}
