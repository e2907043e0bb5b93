package db.pesa.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.ForeignKey;
import db.pesa.catalog.TableSchema;
import db.pesa.error.ConstraintViolationException;
import db.pesa.error.PersistenceException;
import db.pesa.index.HashIndex;

public class DatabasePersistenceTest {

    @TempDir
    Path dir;

    private static Database sample() {
        Database db = new Database("shop");
        Table users = db.createTable(new TableSchema("users", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            new ColumnSchema("email", DataType.STRING, false, true, null),
            ColumnSchema.of("balance", DataType.FLOAT),
            ColumnSchema.of("active", DataType.BOOL))));
        db.createTable(new TableSchema("orders", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            new ColumnSchema("user_id", DataType.INT, false, false, new ForeignKey("users", "id")))));
        users.insert(Arrays.asList(1L, "a@x", 10.5, true));
        users.insert(Arrays.asList(2L, null, 3.0, false));
        users.insert(Arrays.asList(3L, "c@x", null, null));
        users.delete(List.of(users.lookup("id", 2L).get(0)));
        users.insert(Arrays.asList(4L, "d@x", 1.0, true));
        db.table("orders").insert(Arrays.asList(100L, 1L));
        return db;
    }

    @Test
    void roundTripPreservesSchemaRowsOrderAndIndexes() {
        DatabasePersistence p = new DatabasePersistence(dir);
        Database original = sample();
        p.save(original);
        Database loaded = p.load("shop");

        assertEquals(original.listTables(), loaded.listTables());
        for (String name : original.listTables()) {
            Table a = original.table(name);
            Table b = loaded.table(name);
            assertEquals(a.schema(), b.schema());
            assertEquals(new ArrayList<>(a.rows().values()), new ArrayList<>(b.rows().values()));
            for (HashIndex idx : a.indexes()) {
                assertEquals(new HashSet<>(idx.keys()), new HashSet<>(b.index(idx.columnName()).keys()));
            }
        }
        Table users = loaded.table("users");
        assertEquals(Long.class, users.rows().values().iterator().next().get(0).getClass());
        assertEquals(Double.class, users.rows().values().iterator().next().get(2).getClass());
        assertThrows(ConstraintViolationException.class, () -> users.insert(Arrays.asList(1L, "z", null, null)));
    }

    @Test
    void saveReplacesDocumentWithoutLeavingTempFile() throws IOException {
        DatabasePersistence p = new DatabasePersistence(dir);
        Database db = sample();
        p.save(db);
        db.table("users").insert(Arrays.asList(9L, "n@x", 0.0, false));
        p.save(db);
        assertTrue(Files.exists(dir.resolve("shop.json")));
        assertFalse(Files.exists(dir.resolve("shop.json.tmp")));
        assertEquals(4, p.load("shop").table("users").size());
    }

    @Test
    void catalogDocumentListsDatabases() {
        DatabasePersistence p = new DatabasePersistence(dir);
        assertTrue(p.loadCatalog().isEmpty());
        p.saveCatalog(List.of("a", "b"));
        assertEquals(List.of("a", "b"), p.loadCatalog());
    }

    @Test
    void corruptDocumentRaisesPersistenceFailure() throws IOException {
        Files.writeString(dir.resolve("bad.json"), "{ not json");
        DatabasePersistence p = new DatabasePersistence(dir);
        assertThrows(PersistenceException.class, () -> p.load("bad"));
        assertThrows(PersistenceException.class, () -> p.load("missing"));
    }
}
