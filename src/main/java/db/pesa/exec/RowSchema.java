package db.pesa.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.TableSchema;
import db.pesa.error.ColumnNotFoundException;
import db.pesa.expr.AggregateCall;
import db.pesa.expr.ColumnResolver;
import db.pesa.expr.ColumnRef;

/**
 * Column layout of rows flowing between operators, plus optional select-list aliases.
 * <p>
 * Unqualified names resolve to the first matching table column, so in a join the left table
 * wins. Aliases are consulted only when no real column matches.
 */
public final class RowSchema implements ColumnResolver {
    private final List<OutputColumn> columns;
    private final Map<String, Integer> aliases;

    public RowSchema(List<OutputColumn> columns) {
        this(columns, Map.of());
    }

    private RowSchema(List<OutputColumn> columns, Map<String, Integer> aliases) {
        this.columns = List.copyOf(columns);
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static RowSchema forTable(TableSchema table) {
        List<OutputColumn> cols = new ArrayList<>(table.columns().size());
        for (ColumnSchema c : table.columns()) cols.add(OutputColumn.of(table.name(), c.name(), c.type()));
        return new RowSchema(cols);
    }

    public RowSchema concat(RowSchema right) {
        List<OutputColumn> cols = new ArrayList<>(columns);
        cols.addAll(right.columns);
        return new RowSchema(cols);
    }

    public RowSchema withAliases(Map<String, Integer> extra) {
        Map<String, Integer> merged = new LinkedHashMap<>(aliases);
        merged.putAll(extra);
        return new RowSchema(columns, merged);
    }

    public List<OutputColumn> columns() { return columns; }
    public OutputColumn column(int index) { return columns.get(index); }
    public int size() { return columns.size(); }

    public boolean hasAlias(String name) { return aliases.containsKey(name); }

    /** Distinct table names in column order. */
    public List<String> tables() {
        List<String> out = new ArrayList<>();
        for (OutputColumn c : columns) {
            if (c.table() != null && !out.contains(c.table())) out.add(c.table());
        }
        return out;
    }

    /** Position of a table column, or -1. Aliases are not considered. */
    public int find(ColumnRef ref) {
        for (int i = 0; i < columns.size(); i++) {
            OutputColumn c = columns.get(i);
            if (c.isAggregate() || !c.name().equals(ref.column())) continue;
            if (ref.table() == null || ref.table().equals(c.table())) return i;
        }
        return -1;
    }

    @Override
    public int indexOf(ColumnRef ref) {
        int i = find(ref);
        if (i >= 0) return i;
        if (ref.table() == null) {
            Integer aliased = aliases.get(ref.column());
            if (aliased != null) return aliased;
        }
        throw new ColumnNotFoundException("Column '" + ref + "' does not exist"
            + (tables().isEmpty() ? "" : " in " + String.join(", ", tables())));
    }

    /** Position of an aggregate pseudo-column, or -1. Matches on function and column name. */
    public int find(AggregateCall call) {
        for (int i = 0; i < columns.size(); i++) {
            AggregateCall have = columns.get(i).aggregate();
            if (have == null || have.function() != call.function()) continue;
            if (have.isStar() ? call.isStar() : !call.isStar() && have.argument().column().equals(call.argument().column())) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public int indexOf(AggregateCall call) {
        int i = find(call);
        if (i < 0) throw new ColumnNotFoundException("Aggregate " + call.canonicalName() + " is not available here");
        return i;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        for (OutputColumn c : columns) names.add(c.qualifiedName());
        return "RowSchema" + names;
    }
}
