package db.pesa.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import db.pesa.expr.Values;

/**
 * Materializing stable sort on one or more keys. NULL sorts after every non-NULL value in both
 * directions.
 */
public class SortOperator implements Operator {

    public record SortKey(int index, boolean descending) {}

    private final Operator child;
    private final List<SortKey> keys;
    private Iterator<Row> output;

    public SortOperator(Operator child, List<SortKey> keys) {
        this.child = child;
        this.keys = List.copyOf(keys);
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) rows.add(r);
        child.close();
        rows.sort(comparator()); // List.sort is stable
        output = rows.iterator();
    }

    private Comparator<Row> comparator() {
        return (a, b) -> {
            for (SortKey k : keys) {
                Object x = a.get(k.index());
                Object y = b.get(k.index());
                int c;
                if (x == null || y == null) {
                    c = x == null ? (y == null ? 0 : 1) : -1;
                } else {
                    c = Values.compare(x, y);
                    if (k.descending()) c = -c;
                }
                if (c != 0) return c;
            }
            return 0;
        };
    }

    @Override
    public Row next() {
        return output != null && output.hasNext() ? output.next() : null;
    }

    @Override
    public void close() { output = null; }

    @Override
    public RowSchema schema() { return child.schema(); }
}
