package db.pesa.exec;

import db.pesa.catalog.DataType;
import db.pesa.expr.AggregateCall;

// One column of an operator's output. table is null for aggregate pseudo-columns,
// aggregate is null for plain table columns.
public record OutputColumn(String table, String name, DataType type, AggregateCall aggregate) {

    public static OutputColumn of(String table, String name, DataType type) {
        return new OutputColumn(table, name, type, null);
    }

    public static OutputColumn aggregate(AggregateCall call, DataType type) {
        return new OutputColumn(null, call.canonicalName(), type, call);
    }

    public boolean isAggregate() { return aggregate != null; }

    public String qualifiedName() { return table == null ? name : table + "." + name; }
}
