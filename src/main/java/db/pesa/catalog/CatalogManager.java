package db.pesa.catalog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pesa.error.DatabaseNotFoundException;
import db.pesa.error.DuplicateObjectException;
import db.pesa.error.InvalidSchemaException;
import db.pesa.error.PersistenceException;
import db.pesa.storage.Database;
import db.pesa.storage.DatabasePersistence;

/**
 * Top-level registry of databases. With a data directory it loads every database listed in
 * catalog.json at construction and writes documents back on {@link #flush(String)}; the
 * no-arg constructor gives a purely in-memory catalog.
 */
public class CatalogManager {
    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);
    private static final Pattern DATABASE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final Map<String, Database> databases = new LinkedHashMap<>();
    private final DatabasePersistence persistence; // null => in-memory only

    public CatalogManager() {
        this.persistence = null;
    }

    public CatalogManager(Path dataDir) {
        this.persistence = new DatabasePersistence(dataDir);
        loadCatalog();
    }

    public boolean isPersistent() { return persistence != null; }

    public Database createDatabase(String name) {
        if (name == null || !DATABASE_NAME.matcher(name).matches()) {
            throw new InvalidSchemaException("Invalid database name '" + name
                + "': only letters, digits, underscores and hyphens are allowed");
        }
        if (databases.containsKey(name)) throw new DuplicateObjectException("Database '" + name + "' already exists");
        Database db = new Database(name);
        if (persistence != null) {
            List<String> names = listDatabases();
            names.add(name);
            persistence.save(db);
            try {
                persistence.saveCatalog(names);
            } catch (PersistenceException e) {
                discardDocument(name, e);
                throw e;
            }
        }
        databases.put(name, db);
        log.info("Created database '{}'", name);
        return db;
    }

    public Database getDatabase(String name) {
        Database db = databases.get(name);
        if (db == null) throw new DatabaseNotFoundException("Database '" + name + "' does not exist");
        return db;
    }

    public boolean databaseExists(String name) { return databases.containsKey(name); }

    public void dropDatabase(String name) {
        getDatabase(name);
        if (persistence != null) {
            List<String> names = listDatabases();
            names.remove(name);
            persistence.saveCatalog(names);
            databases.remove(name);
            discardDocument(name, null);
        } else {
            databases.remove(name);
        }
        log.info("Dropped database '{}'", name);
    }

    public List<String> listDatabases() { return new ArrayList<>(databases.keySet()); }

    /** Writes the database document synchronously. No-op for an in-memory catalog. */
    public void flush(String name) {
        Database db = getDatabase(name);
        if (persistence == null) return;
        persistence.save(db);
        log.debug("Flushed database '{}'", name);
    }

    /**
     * Replaces the in-memory database with its last written document, dropping any change made
     * since the last successful flush. No-op for an in-memory catalog.
     */
    public void reload(String name) {
        getDatabase(name);
        if (persistence == null) return;
        databases.put(name, persistence.load(name));
        log.info("Reloaded database '{}' from its last flushed state", name);
    }

    // The catalog no longer lists the database, so a leftover file is only garbage.
    private void discardDocument(String name, PersistenceException cause) {
        try {
            persistence.delete(name);
        } catch (PersistenceException e) {
            if (cause != null) cause.addSuppressed(e);
            else log.warn("Could not delete document of database '{}': {}", name, e.getMessage());
        }
    }

    private void loadCatalog() {
        List<String> names;
        try {
            names = persistence.loadCatalog();
        } catch (PersistenceException e) {
            log.warn("Failed loading catalog metadata from {}: {}", persistence.dataDir(), e.getMessage());
            return;
        }
        for (String name : names) {
            try {
                databases.put(name, persistence.load(name));
            } catch (PersistenceException e) {
                log.warn("Skipping database '{}': {}", name, e.getMessage());
            }
        }
        log.info("Loaded {} database(s) from {}", databases.size(), persistence.dataDir());
    }
}
