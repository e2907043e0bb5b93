package db.pesa.exec;

import java.util.ArrayList;
import java.util.List;

import db.pesa.storage.RID;
import db.pesa.storage.Record;

/**
 * Row is an execution pipeline unit (values + RID).
 * Record is the stored form; rows built by joins or aggregates carry no RID.
 */
public class Row {
    private final Record record;
    private final RID rid; // null for derived rows

    public static Row of(Record record, RID rid) { return new Row(record, rid); }

    public static Row derived(List<Object> values) { return new Row(new Record(values), null); }

    public Row(Record record, RID rid) {
        this.record = record;
        this.rid = rid;
    }

    public Record record() { return record; }
    public RID rid() { return rid; }
    public List<Object> values() { return record.getValues(); }
    public Object get(int index) { return record.get(index); }

    /** Values of this row followed by the values of other. */
    public Row concat(Row other) {
        List<Object> joined = new ArrayList<>(values().size() + other.values().size());
        joined.addAll(values());
        joined.addAll(other.values());
        return derived(joined);
    }

    @Override
    public String toString() {
        return "Row" + values() + (rid != null ? " rid=" + rid : "");
    }
}
