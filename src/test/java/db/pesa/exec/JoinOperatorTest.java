package db.pesa.exec;

import static db.pesa.exec.OperatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.TableSchema;
import db.pesa.expr.ColumnRef;
import db.pesa.storage.Table;

public class JoinOperatorTest {

    @Test
    void innerJoinPairsMatchingRowsOnly() {
        Table students = employees(row(1L, "Alice", "cs", 10L), row(2L, "Bob", "math", 20L), row(3L, "Eve", null, 30L));
        Table enrollments = new Table(new TableSchema("enrollments", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            ColumnSchema.of("student_id", DataType.INT),
            ColumnSchema.of("course", DataType.STRING))));
        enrollments.insert(Arrays.asList(100L, 1L, "Math"));
        enrollments.insert(Arrays.asList(101L, 1L, "Physics"));
        enrollments.insert(Arrays.asList(102L, 2L, "Chemistry"));
        enrollments.insert(Arrays.asList(103L, 9L, "Orphan"));

        Operator left = new SeqScanOperator(students);
        Operator right = new SeqScanOperator(enrollments);
        RowSchema joined = left.schema().concat(right.schema());
        int l = joined.indexOf(new ColumnRef("employees", "id"));
        int r = joined.indexOf(new ColumnRef("enrollments", "student_id"));
        JoinOperator join = new JoinOperator(left, right, row -> row.get(l).equals(row.get(r)));

        List<List<Object>> rows = drain(join);
        assertEquals(3, rows.size());
        for (List<Object> v : rows) assertEquals(7, v.size());
        assertEquals(List.of("Alice", "Alice", "Bob"), column(rows, 1));
        assertEquals(List.of("Math", "Physics", "Chemistry"), column(rows, 6));
        assertEquals(7, join.schema().size());
    }

    @Test
    void unqualifiedNameResolvesToLeftTable() {
        Table a = employees(row(1L, "x", "d", 1L));
        Table b = new Table(new TableSchema("other", List.of(ColumnSchema.primaryKey("id", DataType.INT))));
        RowSchema joined = RowSchema.forTable(a.schema()).concat(RowSchema.forTable(b.schema()));
        assertEquals(0, joined.indexOf(ColumnRef.of("id")));
        assertEquals(4, joined.indexOf(new ColumnRef("other", "id")));
    }

    @Test
    void emptySideYieldsNothing() {
        Table a = employees(row(1L, "x", "d", 1L));
        Table empty = employees();
        assertTrue(drain(new JoinOperator(new SeqScanOperator(a), new SeqScanOperator(empty), row -> true)).isEmpty());
        assertTrue(drain(new JoinOperator(new SeqScanOperator(empty), new SeqScanOperator(a), row -> true)).isEmpty());
    }
}
