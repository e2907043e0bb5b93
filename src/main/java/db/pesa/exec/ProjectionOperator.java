package db.pesa.exec;

import java.util.ArrayList;
import java.util.List;

import db.pesa.storage.Record;

/**
 * Projection operator: selects a subset of columns from child rows, by position.
 * Keeps the original RID.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order
    private final RowSchema schema;

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
        List<OutputColumn> cols = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) cols.add(child.schema().column(idx));
        this.schema = new RowSchema(cols);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) projected.add(r.get(idx));
        return Row.of(new Record(projected), r.rid());
    }

    @Override
    public void close() { child.close(); }

    @Override
    public RowSchema schema() { return schema; }
}
