package db.pesa.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import db.pesa.storage.RID;
import db.pesa.storage.Record;
import db.pesa.storage.Table;

/**
 * Physical operator that performs a full table scan in insertion order.
 * Used when no index is applied or when the query requests all rows.
 * Rows are snapshotted at open() so the caller may mutate the table after draining.
 */
public class SeqScanOperator implements Operator {
    private final Table table;
    private final RowSchema schema;

    private Iterator<Map.Entry<RID, Record>> iter;

    public SeqScanOperator(Table table) {
        this.table = table;
        this.schema = RowSchema.forTable(table.schema());
    }

    @Override
    public void open() {
        List<Map.Entry<RID, Record>> snapshot = new ArrayList<>(table.rows().entrySet());
        iter = snapshot.iterator();
    }

    @Override
    public Row next() {
        if (iter == null || !iter.hasNext()) return null;
        Map.Entry<RID, Record> e = iter.next();
        return Row.of(e.getValue(), e.getKey());
    }

    @Override
    public void close() { iter = null; }

    @Override
    public RowSchema schema() { return schema; }
}
