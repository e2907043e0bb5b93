package db.pesa.query;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pesa.catalog.CatalogManager;
import db.pesa.catalog.Session;
import db.pesa.error.DbException;
import db.pesa.error.ErrorKind;
import db.pesa.error.PersistenceException;
import db.pesa.error.UnsupportedFeatureException;
import db.pesa.exec.Row;

/**
 * Processor combining parsing, planning and execution. This is the command boundary: every
 * failure leaves as a {@link DbException} with a stable {@link ErrorKind}.
 * <p>
 * With auto-flush on, every successful statement that changes tables writes the session's
 * database document before returning.
 */
public class QueryProcessor {
    private static final Logger log = LoggerFactory.getLogger(QueryProcessor.class);

    private final QueryParser parser = new QueryParser();
    private final CatalogManager catalog;
    private final QueryPlanner planner;
    private final QueryExecutor executor;
    private final boolean autoFlush;

    public QueryProcessor(CatalogManager catalog) {
        this(catalog, true);
    }

    public QueryProcessor(CatalogManager catalog, boolean autoFlush) {
        this.catalog = catalog;
        this.planner = new QueryPlanner(new PredicateCompiler());
        this.executor = new QueryExecutor(catalog, planner);
        this.autoFlush = autoFlush;
    }

    public CatalogManager catalog() { return catalog; }

    /** Parses and runs one statement. */
    public QueryResult execute(Session session, String sql) {
        try {
            Query query = parser.parse(sql);
            log.debug("Executing {} {}", query.category(), query.getClass().getSimpleName());
            QueryResult result = executor.execute(query, session);
            if (autoFlush && query.mutatesTables()) flushOrRollBack(session);
            return result;
        } catch (DbException e) {
            log.debug("Statement failed: {}", e.toString());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing: {}", sql, e);
            throw internalError(e);
        }
    }

    // A statement whose changes cannot be written does not stay applied in memory either.
    private void flushOrRollBack(Session session) {
        String name = session.requireDatabase();
        try {
            catalog.flush(name);
        } catch (PersistenceException e) {
            try {
                catalog.reload(name);
            } catch (DbException reloadFailure) {
                e.addSuppressed(reloadFailure);
                log.error("Could not restore database '{}' after a failed flush", name, reloadFailure);
            }
            throw e;
        }
    }

    private static DbException internalError(RuntimeException e) {
        return new DbException(ErrorKind.INTERNAL_ERROR, "Internal error: " + e, e);
    }

    /**
     * Runs a semicolon-separated script statement by statement. The first failing statement
     * aborts the rest; statements before it stay applied.
     */
    public List<QueryResult> executeScript(Session session, String script) {
        List<QueryResult> results = new ArrayList<>();
        for (String stmt : splitStatements(script)) results.add(execute(session, stmt));
        return results;
    }

    public List<String> splitStatements(String script) {
        try {
            return parser.splitStatements(script);
        } catch (DbException e) {
            throw e;
        } catch (RuntimeException e) {
            throw internalError(e);
        }
    }

    /**
     * Streams the rows of a SELECT lazily instead of materializing them. Failures while
     * iterating surface as {@link DbException}s, like those of {@link #execute}.
     */
    public Iterable<Row> stream(Session session, String sql) {
        Iterable<Row> rows;
        try {
            Query query = parser.parse(sql);
            if (!(query instanceof SelectQuery select)) {
                throw new UnsupportedFeatureException("Only SELECT statements can be streamed, got "
                    + query.getClass().getSimpleName());
            }
            QueryPlanner.SelectPlan plan = planner.plan(select, catalog.getDatabase(session.requireDatabase()));
            rows = executor.stream(plan.root());
        } catch (DbException e) {
            throw e;
        } catch (RuntimeException e) {
            throw internalError(e);
        }
        return () -> new GuardedIterator(rows.iterator());
    }

    private static final class GuardedIterator implements Iterator<Row> {
        private final Iterator<Row> delegate;

        GuardedIterator(Iterator<Row> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            try {
                return delegate.hasNext();
            } catch (DbException e) {
                throw e;
            } catch (RuntimeException e) {
                throw internalError(e);
            }
        }

        @Override
        public Row next() {
            try {
                return delegate.next();
            } catch (DbException | NoSuchElementException e) {
                throw e;
            } catch (RuntimeException e) {
                throw internalError(e);
            }
        }
    }

    /** Writes the session's current database to disk. */
    public void flush(Session session) {
        catalog.flush(session.requireDatabase());
    }
}
