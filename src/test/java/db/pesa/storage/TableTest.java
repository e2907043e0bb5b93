package db.pesa.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.TableSchema;
import db.pesa.error.ConstraintViolationException;
import db.pesa.error.TypeMismatchException;
import db.pesa.index.HashIndex;

public class TableTest {

    private static Table users() {
        return new Table(new TableSchema("users", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            new ColumnSchema("email", DataType.STRING, false, true, null),
            ColumnSchema.of("age", DataType.INT),
            ColumnSchema.of("score", DataType.FLOAT))));
    }

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    // every index's key set mirrors its column's values
    private static void assertIndexesConsistent(Table t) {
        for (HashIndex idx : t.indexes()) {
            Set<Object> keys = new HashSet<>(idx.keys());
            assertEquals(t.columnValues(idx.columnIndex()), keys, "index on " + idx.columnName());
            assertEquals(t.size(), idx.size());
        }
    }

    @Test
    void insertCreatesIndexesForKeyColumns() {
        Table t = users();
        t.insert(row(1L, "a@x", 30L, 1.5));
        assertNotNull(t.index("id"));
        assertNotNull(t.index("email"));
        assertNull(t.index("age"));
        assertEquals(1, t.lookup("id", 1L).size());
        assertIndexesConsistent(t);
    }

    @Test
    void insertNormalizesTypes() {
        Table t = users();
        RID rid = t.insert(row(1, "a@x", 30, 2L));
        assertEquals(List.of(1L, "a@x", 30L, 2.0), t.get(rid).getValues());
    }

    @Test
    void duplicatePrimaryKeyLeavesTableUntouched() {
        Table t = users();
        t.insert(row(1L, "a@x", 25L, null));
        ConstraintViolationException ex = assertThrows(ConstraintViolationException.class,
            () -> t.insert(row(1L, "b@x", 99L, null)));
        assertTrue(ex.getMessage().contains("PRIMARY KEY"));
        assertEquals(1, t.size());
        assertEquals(25L, t.get(t.lookup("id", 1L).get(0)).get(2));
        assertFalse(t.index("email").contains("b@x"));
        assertIndexesConsistent(t);
    }

    @Test
    void batchInsertIsAllOrNothing() {
        Table t = users();
        t.insert(row(1L, "a@x", 1L, null));
        List<List<Object>> batch = List.of(row(2L, "b@x", 1L, null), row(3L, "a@x", 1L, null));
        assertThrows(ConstraintViolationException.class, () -> t.insertAll(batch));
        assertEquals(1, t.size());
        List<List<Object>> selfDup = List.of(row(4L, "c@x", 1L, null), row(4L, "d@x", 1L, null));
        assertThrows(ConstraintViolationException.class, () -> t.insertAll(selfDup));
        assertEquals(1, t.size());
        assertIndexesConsistent(t);
    }

    @Test
    void uniqueAllowsSeveralNulls() {
        Table t = users();
        t.insert(row(1L, null, 1L, null));
        t.insert(row(2L, null, 1L, null));
        assertEquals(2, t.lookup("email", null).size());
        assertIndexesConsistent(t);
    }

    @Test
    void nullPrimaryKeyAndWrongTypesRejected() {
        Table t = users();
        assertThrows(ConstraintViolationException.class, () -> t.insert(row(null, "a", 1L, null)));
        assertThrows(TypeMismatchException.class, () -> t.insert(row(1L, "a", "old", null)));
        assertThrows(TypeMismatchException.class, () -> t.insert(row(1L, "a")));
        assertEquals(0, t.size());
    }

    @Test
    void updateMovesIndexEntries() {
        Table t = users();
        RID r1 = t.insert(row(1L, "a@x", 1L, null));
        t.insert(row(2L, "b@x", 1L, null));
        Map<RID, List<Object>> changes = new LinkedHashMap<>();
        changes.put(r1, row(10L, "z@x", 1L, null));
        t.update(changes);
        assertTrue(t.lookup("id", 1L).isEmpty());
        assertEquals(List.of(r1), t.lookup("id", 10L));
        assertIndexesConsistent(t);
    }

    @Test
    void updateConflictLeavesEveryRowUntouched() {
        Table t = users();
        RID r1 = t.insert(row(1L, "a@x", 1L, null));
        RID r2 = t.insert(row(2L, "b@x", 1L, null));
        Map<RID, List<Object>> changes = new LinkedHashMap<>();
        changes.put(r1, row(1L, "a@x", 50L, null));
        changes.put(r2, row(2L, "a@x", 50L, null));
        assertThrows(ConstraintViolationException.class, () -> t.update(changes));
        assertEquals(1L, t.get(r1).get(2));
        assertEquals("b@x", t.get(r2).get(1));
        assertIndexesConsistent(t);
    }

    @Test
    void updateMaySwapKeysWithinOneBatch() {
        Table t = users();
        RID r1 = t.insert(row(1L, "a@x", 1L, null));
        RID r2 = t.insert(row(2L, "b@x", 1L, null));
        Map<RID, List<Object>> changes = new LinkedHashMap<>();
        changes.put(r1, row(2L, "a@x", 1L, null));
        changes.put(r2, row(1L, "b@x", 1L, null));
        t.update(changes);
        assertEquals(List.of(r2), t.lookup("id", 1L));
        assertEquals(List.of(r1), t.lookup("id", 2L));
        assertIndexesConsistent(t);
    }

    @Test
    void deleteRemovesRowsAndIndexEntries() {
        Table t = users();
        List<RID> rids = new ArrayList<>();
        for (long i = 1; i <= 4; i++) rids.add(t.insert(row(i, "u" + i, i, null)));
        assertEquals(2, t.delete(List.of(rids.get(1), rids.get(3))));
        assertEquals(2, t.size());
        assertFalse(t.index("email").contains("u2"));
        assertIndexesConsistent(t);
        List<Long> ids = new ArrayList<>();
        for (Record r : t.rows().values()) ids.add((Long) r.get(0));
        assertEquals(List.of(1L, 3L), ids);
    }
}
