package db.pesa.storage;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.ForeignKey;
import db.pesa.catalog.TableSchema;
import db.pesa.error.DbException;
import db.pesa.error.PersistenceException;

/**
 * Reads and writes one JSON document per database (schema + rows) with Gson.
 * Writes go to a temporary file that is then renamed over the previous document, so a crash
 * mid-write leaves the last committed document intact. Indexes are not stored; loading
 * re-inserts every row, which rebuilds them.
 */
public class DatabasePersistence {
    private static final Logger log = LoggerFactory.getLogger(DatabasePersistence.class);

    private final Path dataDir;
    private final Gson gson = new GsonBuilder()
        .serializeNulls()
        .setPrettyPrinting()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();

    public DatabasePersistence(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path dataDir() { return dataDir; }

    public Path fileFor(String databaseName) {
        return dataDir.resolve(databaseName + ".json");
    }

    public void save(Database db) {
        writeAtomically(fileFor(db.name()), toDocument(db));
    }

    public Database load(String databaseName) {
        Path file = fileFor(databaseName);
        DatabaseDocument doc;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            doc = gson.fromJson(reader, DatabaseDocument.class);
        } catch (IOException | JsonParseException e) {
            throw new PersistenceException("Failed loading database file: " + file, e);
        }
        if (doc == null) throw new PersistenceException("Empty database file: " + file, null);
        try {
            return fromDocument(databaseName, doc);
        } catch (DbException | IllegalArgumentException | ClassCastException e) {
            throw new PersistenceException("Corrupt database file " + file + ": " + e.getMessage(), e);
        }
    }

    public void delete(String databaseName) {
        try {
            Files.deleteIfExists(fileFor(databaseName));
        } catch (IOException e) {
            throw new PersistenceException("Failed deleting database file for '" + databaseName + "'", e);
        }
    }

    /** Catalog metadata: the list of database names. */
    public void saveCatalog(List<String> databaseNames) {
        writeAtomically(dataDir.resolve("catalog.json"), Map.of("databases", databaseNames));
    }

    public List<String> loadCatalog() {
        Path file = dataDir.resolve("catalog.json");
        if (!Files.exists(file)) return List.of();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CatalogDocument doc = gson.fromJson(reader, CatalogDocument.class);
            return doc == null || doc.databases == null ? List.of() : doc.databases;
        } catch (IOException | JsonParseException e) {
            throw new PersistenceException("Failed loading catalog file: " + file, e);
        }
    }

    private void writeAtomically(Path target, Object document) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(dataDir);
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(document, writer);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed saving file: " + target, e);
        }
    }

    private DatabaseDocument toDocument(Database db) {
        DatabaseDocument doc = new DatabaseDocument();
        doc.name = db.name();
        doc.tables = new ArrayList<>();
        for (Table t : db.tables()) {
            TableDocument td = new TableDocument();
            td.name = t.name();
            td.columns = new ArrayList<>();
            for (ColumnSchema c : t.schema().columns()) {
                ColumnDocument cd = new ColumnDocument();
                cd.name = c.name();
                cd.type = c.type().name();
                cd.primaryKey = c.primaryKey();
                cd.unique = c.unique();
                if (c.references() != null) {
                    cd.referencesTable = c.references().table();
                    cd.referencesColumn = c.references().column();
                }
                td.columns.add(cd);
            }
            td.rows = new ArrayList<>(t.size());
            for (Record r : t.rows().values()) td.rows.add(r.getValues());
            doc.tables.add(td);
        }
        return doc;
    }

    private Database fromDocument(String databaseName, DatabaseDocument doc) {
        Database db = new Database(databaseName);
        if (doc.tables == null) return db;
        for (TableDocument td : doc.tables) {
            List<ColumnSchema> cols = new ArrayList<>();
            for (ColumnDocument cd : td.columns) {
                ForeignKey fk = cd.referencesTable == null ? null : new ForeignKey(cd.referencesTable, cd.referencesColumn);
                cols.add(new ColumnSchema(cd.name, DataType.valueOf(cd.type), cd.primaryKey, cd.unique, fk));
            }
            Table table = db.createTable(new TableSchema(td.name, cols));
            if (td.rows != null && !td.rows.isEmpty()) table.insertAll(td.rows);
        }
        return db;
    }

    // Gson document shapes

    static final class CatalogDocument {
        List<String> databases;
    }

    static final class DatabaseDocument {
        String name;
        List<TableDocument> tables;
    }

    static final class TableDocument {
        String name;
        List<ColumnDocument> columns;
        List<List<Object>> rows;
    }

    static final class ColumnDocument {
        String name;
        String type;
        boolean primaryKey;
        boolean unique;
        String referencesTable;
        String referencesColumn;
    }
}
