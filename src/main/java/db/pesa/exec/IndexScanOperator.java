package db.pesa.exec;

import java.util.Iterator;
import java.util.List;

import db.pesa.storage.RID;
import db.pesa.storage.Record;
import db.pesa.storage.Table;

/**
 * Equality scan through a column's hash index. Matching rows come back in table order.
 */
public class IndexScanOperator implements Operator {
    private final Table table;
    private final String columnName;
    private final Object key;
    private final RowSchema schema;

    private Iterator<RID> iter;

    public IndexScanOperator(Table table, String columnName, Object key) {
        if (table.index(columnName) == null) {
            throw new IllegalArgumentException("Column '" + columnName + "' of '" + table.name() + "' is not indexed");
        }
        this.table = table;
        this.columnName = columnName;
        this.key = key;
        this.schema = RowSchema.forTable(table.schema());
    }

    public String columnName() { return columnName; }
    public Object key() { return key; }

    @Override
    public void open() {
        List<RID> rids = table.lookup(columnName, key);
        iter = rids.iterator();
    }

    @Override
    public Row next() {
        while (iter != null && iter.hasNext()) {
            RID rid = iter.next();
            Record rec = table.get(rid);
            if (rec != null) return Row.of(rec, rid);
        }
        return null;
    }

    @Override
    public void close() { iter = null; }

    @Override
    public RowSchema schema() { return schema; }
}
