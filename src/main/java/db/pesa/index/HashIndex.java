package db.pesa.index;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import db.pesa.storage.RID;

/**
 * Hash index over one column: value -> identities of the rows holding it.
 * NULL is a regular key so the key set always mirrors the column's values; a unique index
 * only rejects duplicate non-NULL keys.
 * Mutations are driven by Table, which validates before it applies anything.
 */
public class HashIndex {
    private final String columnName;
    private final int columnIndex;
    private final boolean unique;
    private final Map<Object, Set<RID>> entries = new HashMap<>();

    public HashIndex(String columnName, int columnIndex, boolean unique) {
        this.columnName = columnName;
        this.columnIndex = columnIndex;
        this.unique = unique;
    }

    public String columnName() { return columnName; }
    public int columnIndex() { return columnIndex; }
    public boolean isUnique() { return unique; }

    public Set<RID> lookup(Object key) {
        Set<RID> rids = entries.get(key);
        return rids == null ? Set.of() : Collections.unmodifiableSet(rids);
    }

    public boolean contains(Object key) {
        return entries.containsKey(key);
    }

    /**
     * True when placing key on row self would duplicate a key held by another row
     * (only for unique indexes and non-NULL keys).
     */
    public boolean conflicts(Object key, RID self) {
        if (!unique || key == null) return false;
        Set<RID> holders = entries.get(key);
        if (holders == null) return false;
        for (RID rid : holders) {
            if (!rid.equals(self)) return true;
        }
        return false;
    }

    public void add(Object key, RID rid) {
        entries.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(rid);
    }

    public void remove(Object key, RID rid) {
        Set<RID> rids = entries.get(key);
        if (rids == null) return;
        rids.remove(rid);
        if (rids.isEmpty()) entries.remove(key);
    }

    public Set<Object> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        int n = 0;
        for (Set<RID> rids : entries.values()) n += rids.size();
        return n;
    }

    public void clear() { entries.clear(); }

    @Override
    public String toString() {
        return "HashIndex(column=" + columnName + ", unique=" + unique + ", keys=" + entries.size() + ")";
    }
}
