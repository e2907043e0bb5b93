package db.pesa.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.ForeignKey;
import db.pesa.catalog.TableSchema;
import db.pesa.error.InvalidSchemaException;
import db.pesa.error.SqlSyntaxException;
import db.pesa.error.UnsupportedFeatureException;
import db.pesa.expr.AggregateCall;
import db.pesa.expr.AggregateFunction;
import db.pesa.expr.And;
import db.pesa.expr.Between;
import db.pesa.expr.ColumnRef;
import db.pesa.expr.CompareOp;
import db.pesa.expr.Comparison;
import db.pesa.expr.InList;
import db.pesa.expr.IsNull;
import db.pesa.expr.Like;
import db.pesa.expr.Literal;
import db.pesa.expr.Not;
import db.pesa.expr.Or;

public class QueryParserTest {
    private final QueryParser parser = new QueryParser();

    private SelectQuery select(String sql) {
        return (SelectQuery) parser.parse(sql);
    }

    @Test
    void selectStar() {
        SelectQuery q = select("SELECT * FROM users;");
        assertTrue(q.isStar());
        assertEquals("users", q.table());
        assertNull(q.where());
        assertNull(q.join());
    }

    @Test
    void fullSelectClauseOrder() {
        SelectQuery q = select("SELECT DISTINCT department, COUNT(*) AS cnt FROM employees WHERE age > 30 "
            + "GROUP BY department HAVING COUNT(*) > 1 ORDER BY cnt DESC, department LIMIT 5 OFFSET 2");
        assertTrue(q.distinct());
        assertEquals(2, q.items().size());
        assertEquals(ColumnRef.of("department"), q.items().get(0).expression());
        assertEquals(AggregateCall.countStar(), q.items().get(1).expression());
        assertEquals("cnt", q.items().get(1).alias());
        assertEquals(List.of(ColumnRef.of("department")), q.groupBy());
        assertInstanceOf(Comparison.class, q.having());
        assertEquals(2, q.orderBy().size());
        assertTrue(q.orderBy().get(0).descending());
        assertFalse(q.orderBy().get(1).descending());
        assertEquals(5L, q.limit());
        assertEquals(2L, q.offset());
    }

    @Test
    void offsetBeforeLimit() {
        SelectQuery q = select("SELECT x FROM t OFFSET 1 LIMIT 2");
        assertEquals(2L, q.limit());
        assertEquals(1L, q.offset());
    }

    @Test
    void innerJoinWithQualifiedColumns() {
        SelectQuery q = select("SELECT a.id, b.name FROM a INNER JOIN b ON a.id = b.a_id");
        assertEquals("b", q.join().table());
        Comparison on = (Comparison) q.join().on();
        assertEquals(new ColumnRef("a", "id"), on.left());
        assertEquals(new ColumnRef("b", "a_id"), on.right());
        assertEquals("a.id", q.items().get(0).outputName());
        assertNotNull(select("SELECT * FROM a JOIN b ON a.id = b.a_id").join());
    }

    @Test
    void booleanPrecedenceNotAndOr() {
        SelectQuery q = select("SELECT * FROM t WHERE a = 1 OR NOT b = 2 AND c = 3");
        Or or = (Or) q.where();
        assertInstanceOf(Comparison.class, or.left());
        And and = (And) or.right();
        assertInstanceOf(Not.class, and.left());
        assertInstanceOf(Comparison.class, and.right());
    }

    @Test
    void parenthesesOverridePrecedence() {
        SelectQuery q = select("SELECT * FROM t WHERE (a = 1 OR b = 2) AND c = 3");
        And and = (And) q.where();
        assertInstanceOf(Or.class, and.left());
    }

    @Test
    void predicateForms() {
        And where = (And) select("SELECT * FROM t WHERE a IS NOT NULL AND b NOT BETWEEN 1 AND 5 "
            + "AND c IN (1, 2, NULL) AND d NOT LIKE 'x%'").where();
        Like like = (Like) where.right();
        assertTrue(like.negated());
        assertEquals("x%", like.pattern().source());
        And rest = (And) where.left();
        InList in = (InList) rest.right();
        assertEquals(3, in.values().size());
        assertEquals(Literal.NULL, in.values().get(2));
        And first = (And) rest.left();
        assertTrue(((IsNull) first.left()).negated());
        Between between = (Between) first.right();
        assertTrue(between.negated());
        assertEquals(new Literal(5L), between.high());
    }

    @Test
    void literalTypes() {
        Comparison c = (Comparison) select("SELECT * FROM t WHERE x = -1.5").where();
        assertEquals(CompareOp.EQ, c.op());
        assertEquals(new Literal(-1.5), c.right());
        c = (Comparison) select("SELECT * FROM t WHERE x <> 'it''s'").where();
        assertEquals(CompareOp.NE, c.op());
        assertEquals(new Literal("it's"), c.right());
        c = (Comparison) select("SELECT * FROM t WHERE x = true").where();
        assertEquals(new Literal(Boolean.TRUE), c.right());
    }

    @Test
    void createTableWithConstraints() {
        CreateTableQuery q = (CreateTableQuery) parser.parse("CREATE TABLE IF NOT EXISTS orders ("
            + "id INT PRIMARY KEY, code VARCHAR(20) UNIQUE, user_id INTEGER REFERENCES users(id), total FLOAT, paid BOOLEAN)");
        assertTrue(q.ifNotExists());
        TableSchema s = q.schema();
        assertEquals("orders", s.name());
        assertEquals("id", s.primaryKey().name());
        assertTrue(s.column("code").unique());
        assertEquals(DataType.STRING, s.column("code").type());
        assertEquals(new ForeignKey("users", "id"), s.column("user_id").references());
        assertEquals(DataType.FLOAT, s.column("total").type());
        assertEquals(DataType.BOOL, s.column("paid").type());
    }

    @Test
    void tableLevelPrimaryKey() {
        CreateTableQuery q = (CreateTableQuery) parser.parse("CREATE TABLE t (a INT, b STRING, PRIMARY KEY (a))");
        ColumnSchema a = q.schema().column("a");
        assertTrue(a.primaryKey());
    }

    @Test
    void createTableWithoutPrimaryKeyIsInvalid() {
        assertThrows(InvalidSchemaException.class, () -> parser.parse("CREATE TABLE t (a INT, b INT)"));
        assertThrows(InvalidSchemaException.class,
            () -> parser.parse("CREATE TABLE t (a INT PRIMARY KEY, b INT PRIMARY KEY)"));
    }

    @Test
    void insertWithColumnListAndSeveralRows() {
        InsertQuery q = (InsertQuery) parser.parse("INSERT INTO users (id, name) VALUES (1, 'a'), (2, NULL)");
        assertEquals(List.of("id", "name"), q.columns());
        assertEquals(2, q.rows().size());
        assertEquals(1L, q.rows().get(0).get(0));
        assertNull(q.rows().get(1).get(1));
    }

    @Test
    void updateAndDelete() {
        UpdateQuery u = (UpdateQuery) parser.parse("UPDATE users SET age = 30, active = FALSE WHERE id = 1");
        assertEquals(2, u.assignments().size());
        assertEquals(new Assignment("active", Boolean.FALSE), u.assignments().get(1));
        assertNotNull(u.where());
        DeleteQuery d = (DeleteQuery) parser.parse("DELETE FROM users");
        assertFalse(d.hasWhere());
    }

    @Test
    void databaseAndIntrospectionStatements() {
        assertEquals(new CreateDatabaseQuery("shop"), parser.parse("create database shop"));
        assertEquals(new DropDatabaseQuery("shop"), parser.parse("DROP DATABASE shop"));
        assertEquals(new UseQuery("shop"), parser.parse("USE shop"));
        assertEquals(new ShowDatabasesQuery(), parser.parse("SHOW DATABASES"));
        assertEquals(new ShowTablesQuery(), parser.parse("SHOW TABLES"));
        assertEquals(new DescribeQuery("users"), parser.parse("DESCRIBE users"));
        assertEquals(new DescribeQuery("users"), parser.parse("DESC users"));
        assertEquals(new DropTableQuery("users", true), parser.parse("DROP TABLE IF EXISTS users"));
    }

    @Test
    void aggregateCallIsDistinctNodeKind() {
        SelectQuery q = select("SELECT SUM(salary), avg(age), MIN(t.x) FROM t");
        assertEquals(new AggregateCall(AggregateFunction.SUM, ColumnRef.of("salary")), q.items().get(0).expression());
        assertEquals("AVG(age)", q.items().get(1).outputName());
        assertEquals("MIN(t.x)", q.items().get(2).outputName());
    }

    @Test
    void unsupportedAggregateForms() {
        assertThrows(UnsupportedFeatureException.class, () -> parser.parse("SELECT COUNT(DISTINCT a) FROM t"));
        assertThrows(UnsupportedFeatureException.class, () -> parser.parse("SELECT SUM(a*b) FROM t"));
        assertThrows(SqlSyntaxException.class, () -> parser.parse("SELECT SUM(*) FROM t"));
    }

    @Test
    void syntaxErrorNamesTokenAndExpectation() {
        SqlSyntaxException ex = assertThrows(SqlSyntaxException.class, () -> parser.parse("SELECT FROM t"));
        assertEquals("FROM", ex.offending());
        assertEquals(7, ex.position());
        assertTrue(ex.getMessage().contains("Expected"));

        ex = assertThrows(SqlSyntaxException.class, () -> parser.parse("SELECT * FROM t WHERE"));
        assertTrue(ex.getMessage().contains("end of input"));
        assertThrows(SqlSyntaxException.class, () -> parser.parse("SELECT * FROM t extra"));
        assertThrows(SqlSyntaxException.class, () -> parser.parse("  "));
        assertThrows(SqlSyntaxException.class, () -> parser.parse("CREATE TABLE t (a BLOB PRIMARY KEY)"));
    }

    @Test
    void splitStatementsIgnoresSemicolonsInStrings() {
        List<String> stmts = parser.splitStatements("INSERT INTO t VALUES (1, 'a;b'); SELECT * FROM t;; -- done");
        assertEquals(2, stmts.size());
        assertEquals("INSERT INTO t VALUES (1, 'a;b')", stmts.get(0));
        assertEquals(2, parser.parseScript("USE a; SHOW TABLES").size());
    }
}
