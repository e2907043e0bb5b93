package db.pesa.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.TableSchema;
import db.pesa.error.AmbiguousAggregationException;
import db.pesa.error.ColumnNotFoundException;
import db.pesa.error.TypeMismatchException;
import db.pesa.error.UnsupportedFeatureException;
import db.pesa.exec.FilterOperator;
import db.pesa.exec.IndexScanOperator;
import db.pesa.exec.Operator;
import db.pesa.exec.SeqScanOperator;
import db.pesa.expr.Expression;
import db.pesa.storage.Database;
import db.pesa.storage.Table;

public class QueryPlannerTest {
    private final QueryParser parser = new QueryParser();
    private final QueryPlanner planner = new QueryPlanner(new PredicateCompiler());
    private Database db;
    private Table users;

    @BeforeEach
    void setUp() {
        db = new Database("test");
        users = db.createTable(new TableSchema("users", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            new ColumnSchema("email", DataType.STRING, false, true, null),
            ColumnSchema.of("age", DataType.INT),
            ColumnSchema.of("score", DataType.FLOAT))));
        db.createTable(new TableSchema("empty", List.of(ColumnSchema.primaryKey("id", DataType.INT))));
        users.insert(Arrays.asList(1L, "a@x", 20L, 1.5));
        users.insert(Arrays.asList(2L, "b@x", 30L, 2.5));
    }

    private Expression where(String condition) {
        return ((DeleteQuery) parser.parse("DELETE FROM users WHERE " + condition)).where();
    }

    private QueryPlanner.SelectPlan plan(String sql) {
        return planner.plan((SelectQuery) parser.parse(sql), db);
    }

    @Test
    void equalityOnIndexedColumnUsesIndexScan() {
        Operator op = planner.planMutationScan(users, where("id = 2"));
        IndexScanOperator scan = assertInstanceOf(IndexScanOperator.class, op);
        assertEquals("id", scan.columnName());
        assertEquals(2L, scan.key());
        assertInstanceOf(IndexScanOperator.class, planner.planMutationScan(users, where("'b@x' = email")));
    }

    @Test
    void indexScanUnderResidualFilter() {
        assertInstanceOf(FilterOperator.class, planner.planMutationScan(users, where("email = 'a@x' AND age > 5")));
    }

    @Test
    void nonIndexableConditionsFallBackToFullScan() {
        assertInstanceOf(FilterOperator.class, planner.planMutationScan(users, where("age = 20")));
        assertInstanceOf(FilterOperator.class, planner.planMutationScan(users, where("id = 2.0")));
        assertInstanceOf(FilterOperator.class, planner.planMutationScan(users, where("id = NULL")));
        assertInstanceOf(FilterOperator.class, planner.planMutationScan(users, where("id = 1 OR id = 2")));
        assertInstanceOf(SeqScanOperator.class, planner.planMutationScan(users, null));
    }

    @Test
    void unknownColumnFailsEvenOnEmptyTable() {
        assertThrows(ColumnNotFoundException.class, () -> plan("SELECT nope FROM empty"));
        assertThrows(ColumnNotFoundException.class, () -> plan("SELECT id FROM empty WHERE nope = 1"));
        assertThrows(ColumnNotFoundException.class, () -> plan("SELECT id FROM empty ORDER BY nope"));
    }

    @Test
    void aggregationRules() {
        assertThrows(AmbiguousAggregationException.class, () -> plan("SELECT email, COUNT(*) FROM users"));
        assertThrows(AmbiguousAggregationException.class, () -> plan("SELECT * FROM users GROUP BY age"));
        assertThrows(AmbiguousAggregationException.class,
            () -> plan("SELECT age, COUNT(*) FROM users GROUP BY age ORDER BY email"));
        assertThrows(TypeMismatchException.class, () -> plan("SELECT SUM(email) FROM users"));
        assertThrows(UnsupportedFeatureException.class, () -> plan("SELECT id FROM users WHERE COUNT(*) > 1"));
        assertEquals(List.of("age", "n"), plan("SELECT age, COUNT(*) AS n FROM users GROUP BY age HAVING n > 0").columnNames());
    }

    @Test
    void joinRestrictions() {
        assertThrows(UnsupportedFeatureException.class,
            () -> plan("SELECT COUNT(*) FROM users JOIN empty ON users.id = empty.id"));
        assertThrows(UnsupportedFeatureException.class,
            () -> plan("SELECT id FROM users JOIN users ON users.id = users.id"));
        assertEquals(List.of("users.id", "users.email", "users.age", "users.score", "empty.id"),
            plan("SELECT * FROM users JOIN empty ON users.id = empty.id").columnNames());
    }
}
