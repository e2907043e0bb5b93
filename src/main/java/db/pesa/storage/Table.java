package db.pesa.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.TableSchema;
import db.pesa.error.ColumnNotFoundException;
import db.pesa.error.ConstraintViolationException;
import db.pesa.error.TypeMismatchException;
import db.pesa.index.HashIndex;

/**
 * In-memory table: rows in insertion order plus one hash index per PRIMARY KEY, UNIQUE
 * and REFERENCES column.
 * <p>
 * Every mutation validates all affected rows first and only then touches rows and indexes,
 * so a failed insert/update/delete leaves both exactly as they were.
 */
public class Table {
    private final TableSchema schema;
    private final LinkedHashMap<RID, Record> rows = new LinkedHashMap<>();
    private final Map<String, HashIndex> indexes = new LinkedHashMap<>();
    private long nextRowId = 1;

    public Table(TableSchema schema) {
        this.schema = schema;
        List<ColumnSchema> cols = schema.columns();
        for (int i = 0; i < cols.size(); i++) {
            ColumnSchema c = cols.get(i);
            if (c.indexed()) indexes.put(c.name(), new HashIndex(c.name(), i, c.uniqueKey()));
        }
    }

    public String name() { return schema.name(); }
    public TableSchema schema() { return schema; }
    public int size() { return rows.size(); }

    public Record get(RID rid) { return rows.get(rid); }

    /** Live rows in table order (read-only view). */
    public Map<RID, Record> rows() { return Collections.unmodifiableMap(rows); }

    public HashIndex index(String columnName) { return indexes.get(columnName); }

    public Collection<HashIndex> indexes() { return Collections.unmodifiableCollection(indexes.values()); }

    /** Rows whose indexed column equals key, in table order. */
    public List<RID> lookup(String columnName, Object key) {
        HashIndex idx = indexes.get(columnName);
        if (idx == null) throw new IllegalArgumentException("Column '" + columnName + "' of '" + name() + "' is not indexed");
        List<RID> out = new ArrayList<>(idx.lookup(key));
        Collections.sort(out);
        return out;
    }

    public RID insert(List<Object> values) {
        return insertAll(List.of(values)).get(0);
    }

    /**
     * Inserts a batch of full rows (schema order). Either all rows and all their index entries
     * are added, or nothing changes.
     */
    public List<RID> insertAll(List<List<Object>> batch) {
        List<List<Object>> prepared = new ArrayList<>(batch.size());
        for (List<Object> values : batch) prepared.add(validateRow(values));

        Map<String, Map<Object, Integer>> pending = new HashMap<>();
        for (int r = 0; r < prepared.size(); r++) {
            List<Object> values = prepared.get(r);
            for (HashIndex idx : indexes.values()) {
                if (!idx.isUnique()) continue;
                Object key = values.get(idx.columnIndex());
                if (key == null) continue;
                Map<Object, Integer> seen = pending.computeIfAbsent(idx.columnName(), k -> new HashMap<>());
                if (idx.contains(key) || seen.putIfAbsent(key, r) != null) {
                    throw duplicate(idx, key);
                }
            }
        }

        List<RID> rids = new ArrayList<>(prepared.size());
        for (List<Object> values : prepared) {
            RID rid = new RID(nextRowId++);
            rows.put(rid, new Record(values));
            for (HashIndex idx : indexes.values()) idx.add(values.get(idx.columnIndex()), rid);
            rids.add(rid);
        }
        return rids;
    }

    /**
     * Replaces the values of the given rows. Unique keys are re-validated against the final state
     * (other rows plus the other rows of this batch) before any row is touched.
     */
    public void update(Map<RID, List<Object>> changes) {
        Map<RID, List<Object>> prepared = new LinkedHashMap<>();
        for (Map.Entry<RID, List<Object>> e : changes.entrySet()) {
            if (!rows.containsKey(e.getKey())) throw new IllegalArgumentException("No live row " + e.getKey() + " in " + name());
            prepared.put(e.getKey(), validateRow(e.getValue()));
        }

        for (HashIndex idx : indexes.values()) {
            if (!idx.isUnique()) continue;
            Map<Object, RID> claimed = new HashMap<>();
            for (Map.Entry<RID, List<Object>> e : prepared.entrySet()) {
                Object key = e.getValue().get(idx.columnIndex());
                if (key == null) continue;
                for (RID holder : idx.lookup(key)) {
                    // holders inside the batch move to their own new keys
                    if (!prepared.containsKey(holder)) throw duplicate(idx, key);
                }
                RID other = claimed.putIfAbsent(key, e.getKey());
                if (other != null) throw duplicate(idx, key);
            }
        }

        for (Map.Entry<RID, List<Object>> e : prepared.entrySet()) {
            RID rid = e.getKey();
            Record old = rows.get(rid);
            List<Object> next = e.getValue();
            for (HashIndex idx : indexes.values()) {
                Object before = old.get(idx.columnIndex());
                Object after = next.get(idx.columnIndex());
                if (!Objects.equals(before, after)) {
                    idx.remove(before, rid);
                    idx.add(after, rid);
                }
            }
            rows.put(rid, new Record(next));
        }
    }

    /** Removes rows and their index entries. Referential checks are the caller's (Database) job. */
    public int delete(Collection<RID> rids) {
        int deleted = 0;
        for (RID rid : rids) {
            Record old = rows.remove(rid);
            if (old == null) continue;
            for (HashIndex idx : indexes.values()) idx.remove(old.get(idx.columnIndex()), rid);
            deleted++;
        }
        return deleted;
    }

    /** Arity, declared types and PRIMARY KEY not-null. Returns the normalized values. */
    private List<Object> validateRow(List<Object> values) {
        List<ColumnSchema> cols = schema.columns();
        if (values.size() != cols.size()) {
            throw new TypeMismatchException("Value count mismatch for table '" + name() + "': expected "
                + cols.size() + " values " + schema.columnNames() + ", got " + values.size());
        }
        List<Object> out = new ArrayList<>(cols.size());
        for (int i = 0; i < cols.size(); i++) {
            ColumnSchema col = cols.get(i);
            Object v = col.type().coerce(values.get(i), col.name());
            if (v == null && col.primaryKey()) {
                throw new ConstraintViolationException("PRIMARY KEY column '" + col.name() + "' of table '" + name() + "' cannot be NULL");
            }
            out.add(v);
        }
        return out;
    }

    /** Column position or ColumnNotFoundException. */
    public int requireColumn(String columnName) {
        int i = schema.columnIndex(columnName);
        if (i < 0) throw new ColumnNotFoundException("Column '" + columnName + "' does not exist in table '" + name() + "'");
        return i;
    }

    /** Distinct values currently held in a column (used to audit index consistency). */
    public Set<Object> columnValues(int columnIndex) {
        Set<Object> out = new HashSet<>();
        for (Record r : rows.values()) out.add(r.get(columnIndex));
        return out;
    }

    private ConstraintViolationException duplicate(HashIndex idx, Object key) {
        String kind = schema.column(idx.columnName()).primaryKey() ? "PRIMARY KEY" : "UNIQUE";
        return new ConstraintViolationException(kind + " constraint violation: value '" + key
            + "' already exists in column '" + name() + "." + idx.columnName() + "'");
    }

    @Override
    public String toString() {
        return "Table(" + name() + ", columns=" + schema.columns().size() + ", rows=" + rows.size() + ")";
    }
}
