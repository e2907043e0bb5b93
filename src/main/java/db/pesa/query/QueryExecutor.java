package db.pesa.query;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pesa.catalog.CatalogManager;
import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.Session;
import db.pesa.catalog.TableSchema;
import db.pesa.error.TypeMismatchException;
import db.pesa.exec.Operator;
import db.pesa.exec.Row;
import db.pesa.storage.Database;
import db.pesa.storage.RID;
import db.pesa.storage.Table;

/**
 * Binds parsed statements to the catalog and runs them. SELECT pipelines are pulled through
 * {@link #stream(Operator)}; UPDATE and DELETE first collect the matching RIDs and then hand the
 * whole batch to the storage layer, which applies all of it or none of it.
 */
public class QueryExecutor implements Query.Visitor<QueryResult, Session> {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final CatalogManager catalog;
    private final QueryPlanner planner;

    public QueryExecutor(CatalogManager catalog, QueryPlanner planner) {
        this.catalog = catalog;
        this.planner = planner;
    }

    public QueryResult execute(Query query, Session session) {
        return query.accept(this, session);
    }

    /**
     * Streaming interface: returns an Iterable that opens the operator on first iteration
     * and closes it when exhausted.
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new Iterator<Row>() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened) {
                    op.open();
                    opened = true;
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                next = op.next();
                if (next == null) {
                    finished = true;
                    op.close();
                }
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }
        };
    }

    private Database currentDatabase(Session session) {
        return catalog.getDatabase(session.requireDatabase());
    }

    // ---- DDL ----

    @Override
    public QueryResult visitCreateDatabase(CreateDatabaseQuery q, Session session) {
        catalog.createDatabase(q.name());
        return QueryResult.affected(0, "Database '" + q.name() + "' created");
    }

    @Override
    public QueryResult visitDropDatabase(DropDatabaseQuery q, Session session) {
        catalog.dropDatabase(q.name());
        if (q.name().equals(session.currentDatabase())) session.clear();
        return QueryResult.affected(0, "Database '" + q.name() + "' dropped");
    }

    @Override
    public QueryResult visitCreateTable(CreateTableQuery q, Session session) {
        Database db = currentDatabase(session);
        String name = q.schema().name();
        if (q.ifNotExists() && db.hasTable(name)) {
            return QueryResult.affected(0, "Table '" + name + "' already exists, skipped");
        }
        db.createTable(q.schema());
        log.info("Created table '{}.{}'", db.name(), name);
        return QueryResult.affected(0, "Table '" + name + "' created");
    }

    @Override
    public QueryResult visitDropTable(DropTableQuery q, Session session) {
        Database db = currentDatabase(session);
        if (q.ifExists() && !db.hasTable(q.name())) {
            return QueryResult.affected(0, "Table '" + q.name() + "' does not exist, skipped");
        }
        db.dropTable(q.name());
        log.info("Dropped table '{}.{}'", db.name(), q.name());
        return QueryResult.affected(0, "Table '" + q.name() + "' dropped");
    }

    @Override
    public QueryResult visitUse(UseQuery q, Session session) {
        catalog.getDatabase(q.database());
        session.use(q.database());
        return QueryResult.affected(0, "Using database '" + q.database() + "'");
    }

    @Override
    public QueryResult visitShowDatabases(ShowDatabasesQuery q, Session session) {
        List<List<Object>> rows = new ArrayList<>();
        for (String name : catalog.listDatabases()) rows.add(List.of(name));
        return QueryResult.description(List.of("database"), rows, null);
    }

    @Override
    public QueryResult visitShowTables(ShowTablesQuery q, Session session) {
        List<List<Object>> rows = new ArrayList<>();
        for (String name : currentDatabase(session).listTables()) rows.add(List.of(name));
        return QueryResult.description(List.of("table"), rows, null);
    }

    @Override
    public QueryResult visitDescribe(DescribeQuery q, Session session) {
        TableSchema schema = currentDatabase(session).table(q.table()).schema();
        List<List<Object>> rows = new ArrayList<>();
        for (ColumnSchema c : schema.columns()) {
            List<Object> row = new ArrayList<>(5);
            row.add(c.name());
            row.add(c.type().name());
            row.add(c.primaryKey());
            row.add(c.unique());
            row.add(c.references() == null ? null : c.references().toString());
            rows.add(row);
        }
        return QueryResult.description(List.of("column", "type", "primary_key", "unique", "references"), rows, schema);
    }

    // ---- DML ----

    @Override
    public QueryResult visitInsert(InsertQuery q, Session session) {
        Table table = currentDatabase(session).table(q.table());
        List<ColumnSchema> cols = table.schema().columns();
        int[] positions;
        if (q.hasColumnList()) {
            positions = new int[q.columns().size()];
            for (int i = 0; i < positions.length; i++) positions[i] = table.requireColumn(q.columns().get(i));
        } else {
            positions = new int[cols.size()];
            for (int i = 0; i < positions.length; i++) positions[i] = i;
        }

        List<List<Object>> batch = new ArrayList<>(q.rows().size());
        for (List<Object> values : q.rows()) {
            if (values.size() != positions.length) {
                throw new TypeMismatchException("INSERT into '" + table.name() + "' expects " + positions.length
                    + " value(s) per row, got " + values.size());
            }
            List<Object> full = new ArrayList<>(cols.size());
            for (int i = 0; i < cols.size(); i++) full.add(null); // omitted columns are NULL
            for (int i = 0; i < positions.length; i++) full.set(positions[i], values.get(i));
            batch.add(full);
        }
        List<RID> rids = table.insertAll(batch);
        return QueryResult.affected(rids.size(), rids.size() + " row(s) inserted");
    }

    @Override
    public QueryResult visitUpdate(UpdateQuery q, Session session) {
        Database db = currentDatabase(session);
        Table table = db.table(q.table());
        int[] positions = new int[q.assignments().size()];
        for (int i = 0; i < positions.length; i++) positions[i] = table.requireColumn(q.assignments().get(i).column());

        Map<RID, List<Object>> changes = new LinkedHashMap<>();
        for (Row r : stream(planner.planMutationScan(table, q.where()))) {
            List<Object> next = new ArrayList<>(r.values());
            for (int i = 0; i < positions.length; i++) next.set(positions[i], q.assignments().get(i).value());
            changes.put(r.rid(), next);
        }
        if (!changes.isEmpty()) db.updateRows(table, changes);
        return QueryResult.affected(changes.size(), changes.size() + " row(s) updated");
    }

    @Override
    public QueryResult visitDelete(DeleteQuery q, Session session) {
        Database db = currentDatabase(session);
        Table table = db.table(q.table());
        List<RID> rids = new ArrayList<>();
        for (Row r : stream(planner.planMutationScan(table, q.where()))) rids.add(r.rid());
        int deleted = rids.isEmpty() ? 0 : db.deleteRows(table, rids);
        return QueryResult.affected(deleted, deleted + " row(s) deleted");
    }

    // ---- DQL ----

    @Override
    public QueryResult visitSelect(SelectQuery q, Session session) {
        QueryPlanner.SelectPlan plan = planner.plan(q, currentDatabase(session));
        List<List<Object>> rows = new ArrayList<>();
        for (Row r : stream(plan.root())) rows.add(r.values());
        return QueryResult.rows(plan.columnNames(), rows);
    }
}
