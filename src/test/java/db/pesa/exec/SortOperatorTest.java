package db.pesa.exec;

import static db.pesa.exec.OperatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import db.pesa.storage.Table;

public class SortOperatorTest {

    private final Table table = employees(
        row(1L, "a", "ops", 30L),
        row(2L, "b", null, 10L),
        row(3L, "c", "eng", null),
        row(4L, "d", "eng", 10L),
        row(5L, "e", "ops", 20L));

    private List<List<Object>> sorted(SortOperator.SortKey... keys) {
        return drain(new SortOperator(new SeqScanOperator(table), List.of(keys)));
    }

    @Test
    void nullsSortLastInBothDirections() {
        assertEquals(Arrays.asList(10L, 10L, 20L, 30L, null), column(sorted(new SortOperator.SortKey(3, false)), 3));
        assertEquals(Arrays.asList(30L, 20L, 10L, 10L, null), column(sorted(new SortOperator.SortKey(3, true)), 3));
    }

    @Test
    void equalKeysKeepInputOrder() {
        assertEquals(List.of(2L, 4L, 5L, 1L, 3L), column(sorted(new SortOperator.SortKey(3, false)), 0));
    }

    @Test
    void laterKeysBreakTies() {
        List<List<Object>> rows = sorted(new SortOperator.SortKey(2, false), new SortOperator.SortKey(3, true));
        assertEquals(List.of(4L, 3L, 1L, 5L, 2L), column(rows, 0));
    }
}
