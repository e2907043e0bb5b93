package db.pesa.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.pesa.catalog.DataType;
import db.pesa.expr.AggregateCall;

/**
 * Hash aggregation. Output rows hold the GROUP BY values followed by one value per aggregate.
 * <p>
 * Groups come out in order of first appearance; NULL is an ordinary group key. Without GROUP BY
 * every input row falls into one group, which is emitted even when the input is empty.
 */
public class AggregateOperator implements Operator {
    private final Operator child;
    private final int[] groupIndexes;
    private final List<AggregateCall> aggregates;
    private final int[] argumentIndexes; // -1 for COUNT(*)
    private final DataType[] argumentTypes;
    private final RowSchema schema;

    private Iterator<Row> output;

    public AggregateOperator(Operator child, int[] groupIndexes, List<AggregateCall> aggregates) {
        this.child = child;
        this.groupIndexes = groupIndexes.clone();
        this.aggregates = List.copyOf(aggregates);
        RowSchema in = child.schema();
        this.argumentIndexes = new int[aggregates.size()];
        this.argumentTypes = new DataType[aggregates.size()];
        List<OutputColumn> cols = new ArrayList<>();
        for (int g : groupIndexes) cols.add(in.column(g));
        for (int i = 0; i < aggregates.size(); i++) {
            AggregateCall call = aggregates.get(i);
            argumentIndexes[i] = call.isStar() ? -1 : in.indexOf(call.argument());
            argumentTypes[i] = call.isStar() ? null : in.column(argumentIndexes[i]).type();
            cols.add(OutputColumn.aggregate(call, Accumulator.resultType(call, argumentTypes[i])));
        }
        this.schema = new RowSchema(cols);
    }

    public boolean isGrouped() { return groupIndexes.length > 0; }

    @Override
    public void open() {
        child.open();
        Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();
        if (!isGrouped()) groups.put(List.of(), newAccumulators());
        Row r;
        while ((r = child.next()) != null) {
            List<Object> key = new ArrayList<>(groupIndexes.length);
            for (int g : groupIndexes) key.add(r.get(g));
            Accumulator[] accs = groups.computeIfAbsent(key, k -> newAccumulators());
            for (int i = 0; i < accs.length; i++) {
                accs[i].add(argumentIndexes[i] < 0 ? null : r.get(argumentIndexes[i]));
            }
        }
        child.close();

        List<Row> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, Accumulator[]> e : groups.entrySet()) {
            List<Object> values = new ArrayList<>(e.getKey());
            for (Accumulator acc : e.getValue()) values.add(acc.result());
            rows.add(Row.derived(values));
        }
        output = rows.iterator();
    }

    private Accumulator[] newAccumulators() {
        Accumulator[] accs = new Accumulator[aggregates.size()];
        for (int i = 0; i < accs.length; i++) accs[i] = Accumulator.create(aggregates.get(i), argumentTypes[i]);
        return accs;
    }

    @Override
    public Row next() {
        return output != null && output.hasNext() ? output.next() : null;
    }

    @Override
    public void close() { output = null; }

    @Override
    public RowSchema schema() { return schema; }
}
