package db.pesa.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.ForeignKey;
import db.pesa.catalog.TableSchema;
import db.pesa.error.ColumnNotFoundException;
import db.pesa.error.ConstraintViolationException;
import db.pesa.error.DuplicateObjectException;
import db.pesa.error.InvalidSchemaException;
import db.pesa.error.TableNotFoundException;

/**
 * Named set of tables. Owns the cross-table rules: REFERENCES targets must exist and a row that
 * is still referenced can be neither deleted nor have its key changed.
 */
public class Database {
    private final String name;
    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Database(String name) {
        this.name = name;
    }

    public String name() { return name; }

    public Table createTable(TableSchema schema) {
        if (tables.containsKey(schema.name())) {
            throw new DuplicateObjectException("Table '" + schema.name() + "' already exists in database '" + name + "'");
        }
        for (ColumnSchema c : schema.columns()) {
            ForeignKey fk = c.references();
            if (fk == null) continue;
            TableSchema target = fk.table().equals(schema.name()) ? schema : table(fk.table()).schema();
            ColumnSchema targetColumn = target.column(fk.column());
            if (targetColumn == null) {
                throw new ColumnNotFoundException("Column '" + fk.column() + "' referenced by '"
                    + schema.name() + "." + c.name() + "' does not exist in table '" + fk.table() + "'");
            }
            if (targetColumn.type() != c.type()) {
                throw new InvalidSchemaException("Column '" + schema.name() + "." + c.name() + "' (" + c.type()
                    + ") cannot reference '" + fk + "' (" + targetColumn.type() + ")");
            }
        }
        Table t = new Table(schema);
        tables.put(schema.name(), t);
        return t;
    }

    public Table table(String tableName) {
        Table t = tables.get(tableName);
        if (t == null) throw new TableNotFoundException("Table '" + tableName + "' does not exist in database '" + name + "'");
        return t;
    }

    public boolean hasTable(String tableName) { return tables.containsKey(tableName); }

    public void dropTable(String tableName) {
        Table t = table(tableName);
        for (Table other : tables.values()) {
            if (other == t) continue;
            for (ColumnSchema c : other.schema().columns()) {
                if (c.references() != null && c.references().table().equals(tableName)) {
                    throw new ConstraintViolationException("Cannot drop table '" + tableName + "': referenced by '"
                        + other.name() + "." + c.name() + "'");
                }
            }
        }
        tables.remove(tableName);
    }

    public List<String> listTables() { return new ArrayList<>(tables.keySet()); }

    public Collection<Table> tables() { return tables.values(); }

    /**
     * Deletes rows of a table unless another table's REFERENCES column still points at one of them.
     * Nothing is removed when any row is blocked.
     */
    public int deleteRows(Table table, Collection<RID> rids) {
        for (Reference ref : referencesTo(table)) {
            for (RID rid : rids) {
                Object key = table.get(rid).get(ref.targetColumnIndex);
                if (key != null && !ref.source.index(ref.sourceColumn).lookup(key).isEmpty()) {
                    throw blocked("delete row from", table, ref, key);
                }
            }
        }
        return table.delete(rids);
    }

    /**
     * Updates rows of a table; a referenced key value may not change while referencing rows exist.
     */
    public void updateRows(Table table, Map<RID, List<Object>> changes) {
        for (Reference ref : referencesTo(table)) {
            for (Map.Entry<RID, List<Object>> e : changes.entrySet()) {
                Object before = table.get(e.getKey()).get(ref.targetColumnIndex);
                Object after = e.getValue().get(ref.targetColumnIndex);
                if (before == null || Objects.equals(before, after)) continue;
                if (!ref.source.index(ref.sourceColumn).lookup(before).isEmpty()) {
                    throw blocked("update key of", table, ref, before);
                }
            }
        }
        table.update(changes);
    }

    // REFERENCES columns of other tables that point into this one
    private List<Reference> referencesTo(Table target) {
        List<Reference> out = new ArrayList<>();
        for (Table other : tables.values()) {
            if (other == target) continue;
            for (ColumnSchema c : other.schema().columns()) {
                ForeignKey fk = c.references();
                if (fk != null && fk.table().equals(target.name())) {
                    out.add(new Reference(other, c.name(), target.schema().columnIndex(fk.column())));
                }
            }
        }
        return out;
    }

    private ConstraintViolationException blocked(String action, Table table, Reference ref, Object key) {
        int count = ref.source.index(ref.sourceColumn).lookup(key).size();
        return new ConstraintViolationException("Cannot " + action + " '" + table.name() + "' where "
            + table.schema().columns().get(ref.targetColumnIndex).name() + "=" + key + ": referenced by "
            + count + " row(s) in '" + ref.source.name() + "." + ref.sourceColumn + "'");
    }

    private record Reference(Table source, String sourceColumn, int targetColumnIndex) {}

    @Override
    public String toString() { return "Database(" + name + ", tables=" + tables.size() + ")"; }
}
