package db.pesa.catalog;

import db.pesa.error.DatabaseNotFoundException;

/**
 * Per-caller execution context. Holds the database selected by USE; the engine never keeps a
 * process-wide current database.
 */
public class Session {
    private String currentDatabase;

    public Session() {}

    public Session(String currentDatabase) {
        this.currentDatabase = currentDatabase;
    }

    public String currentDatabase() { return currentDatabase; }

    public void use(String databaseName) { this.currentDatabase = databaseName; }

    public void clear() { this.currentDatabase = null; }

    public String requireDatabase() {
        if (currentDatabase == null) {
            throw new DatabaseNotFoundException("No database selected (run USE <database> first)");
        }
        return currentDatabase;
    }
}
