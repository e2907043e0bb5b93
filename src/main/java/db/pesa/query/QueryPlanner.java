package db.pesa.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.error.AmbiguousAggregationException;
import db.pesa.error.TypeMismatchException;
import db.pesa.error.UnsupportedFeatureException;
import db.pesa.exec.AggregateOperator;
import db.pesa.exec.DistinctOperator;
import db.pesa.exec.FilterOperator;
import db.pesa.exec.IndexScanOperator;
import db.pesa.exec.JoinOperator;
import db.pesa.exec.LimitOperator;
import db.pesa.exec.Operator;
import db.pesa.exec.OutputColumn;
import db.pesa.exec.Predicate;
import db.pesa.exec.ProjectionOperator;
import db.pesa.exec.RowSchema;
import db.pesa.exec.SeqScanOperator;
import db.pesa.exec.SortOperator;
import db.pesa.expr.AggregateCall;
import db.pesa.expr.AggregateFunction;
import db.pesa.expr.ColumnRef;
import db.pesa.expr.CompareOp;
import db.pesa.expr.Comparison;
import db.pesa.expr.Expression;
import db.pesa.expr.Expressions;
import db.pesa.expr.Literal;
import db.pesa.storage.Database;
import db.pesa.storage.Table;

/**
 * Planner: builds the physical pipeline for a SelectQuery.
 * Pipeline order:
 *  1. Source: nested-loop join, or an index scan when a top-level AND term is an equality between
 *     an indexed column and a literal, or a full table scan.
 *  2. WHERE filter.
 *  3. Aggregation (GROUP BY or any aggregate) followed by the HAVING filter.
 *  4. ORDER BY, then projection, DISTINCT, OFFSET/LIMIT.
 * Every column is resolved while planning, so binding errors surface even on empty tables.
 */
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private final PredicateCompiler predicateCompiler;

    /** Root operator plus the result key of each output column. */
    public record SelectPlan(Operator root, List<String> columnNames) {}

    public QueryPlanner(PredicateCompiler predicateCompiler) {
        this.predicateCompiler = predicateCompiler;
    }

    public SelectPlan plan(SelectQuery query, Database db) {
        Table left = db.table(query.table());
        if (Expressions.containsAggregate(query.where())) {
            throw new UnsupportedFeatureException("Aggregate functions are not allowed in WHERE (use HAVING)");
        }
        boolean aggregated = !query.groupBy().isEmpty() || query.having() != null;
        for (SelectItem item : query.items()) aggregated |= item.isAggregate();
        for (OrderItem o : query.orderBy()) aggregated |= o.expression() instanceof AggregateCall;

        Operator root;
        if (query.join() != null) {
            if (aggregated) {
                throw new UnsupportedFeatureException("Aggregate functions and GROUP BY cannot be combined with JOIN");
            }
            Table right = db.table(query.join().table());
            if (right == left) throw new UnsupportedFeatureException("Joining a table with itself is not supported");
            if (Expressions.containsAggregate(query.join().on())) {
                throw new UnsupportedFeatureException("Aggregate functions are not allowed in JOIN ... ON");
            }
            Operator leftScan = new SeqScanOperator(left);
            Operator rightScan = new SeqScanOperator(right);
            RowSchema joined = leftScan.schema().concat(rightScan.schema());
            root = new JoinOperator(leftScan, rightScan, predicateCompiler.compile(query.join().on(), joined));
            log.debug("Nested loop join {} x {}", left.name(), right.name());
            if (query.where() != null) {
                root = new FilterOperator(root, predicateCompiler.compile(query.where(), root.schema()));
            }
        } else {
            root = accessPath(left, query.where());
        }

        SelectPlan plan = aggregated ? planAggregated(query, root) : planRows(query, root);
        Operator top = plan.root();
        if (query.distinct()) top = new DistinctOperator(top);
        if (query.limit() != null || query.offset() != null) {
            top = new LimitOperator(top, query.offset() == null ? 0 : query.offset(), query.limit());
        }
        return new SelectPlan(top, plan.columnNames());
    }

    /** Row source for UPDATE/DELETE: the matching rows of one table, with their RIDs. */
    public Operator planMutationScan(Table table, Expression where) {
        if (Expressions.containsAggregate(where)) {
            throw new UnsupportedFeatureException("Aggregate functions are not allowed in WHERE");
        }
        return accessPath(table, where);
    }

    private Operator accessPath(Table table, Expression where) {
        if (where == null) return new SeqScanOperator(table);
        RowSchema schema = RowSchema.forTable(table.schema());
        Predicate full = predicateCompiler.compile(where, schema);
        for (Expression term : Expressions.conjuncts(where)) {
            IndexProbe probe = indexProbe(table, term);
            if (probe == null) continue;
            log.debug("Index scan on {}.{} = {}", table.name(), probe.column(), probe.key());
            Operator scan = new IndexScanOperator(table, probe.column(), probe.key());
            return term == where ? scan : new FilterOperator(scan, full);
        }
        log.debug("Sequential scan on {}", table.name());
        return new FilterOperator(new SeqScanOperator(table), full);
    }

    private record IndexProbe(String column, Object key) {}

    // column = literal (either side) on an indexed column, with a non-NULL literal of a compatible type
    private IndexProbe indexProbe(Table table, Expression term) {
        if (!(term instanceof Comparison cmp) || cmp.op() != CompareOp.EQ) return null;
        ColumnRef ref;
        Literal lit;
        if (cmp.left() instanceof ColumnRef c && cmp.right() instanceof Literal l) {
            ref = c;
            lit = l;
        } else if (cmp.right() instanceof ColumnRef c && cmp.left() instanceof Literal l) {
            ref = c;
            lit = l;
        } else {
            return null;
        }
        if (ref.table() != null && !ref.table().equals(table.name())) return null;
        ColumnSchema col = table.schema().column(ref.column());
        if (col == null || !col.indexed() || lit.value() == null) return null;
        Object key = indexKey(col, lit.value());
        return key == null ? null : new IndexProbe(col.name(), key);
    }

    private static Object indexKey(ColumnSchema col, Object value) {
        if (col.type() == DataType.INT && !(value instanceof Long)) return null;
        if (col.type() == DataType.FLOAT && !(value instanceof Number)) return null;
        if (col.type() == DataType.STRING && !(value instanceof String)) return null;
        if (col.type() == DataType.BOOL && !(value instanceof Boolean)) return null;
        return col.type().coerce(value, col.name());
    }

    // ---- non-aggregated path: sort on the source layout, then project ----

    private SelectPlan planRows(SelectQuery query, Operator root) {
        RowSchema source = root.schema();
        Map<String, Integer> aliases = new LinkedHashMap<>();
        for (SelectItem item : query.items()) {
            if (item.alias() != null) aliases.put(item.alias(), source.indexOf((ColumnRef) item.expression()));
        }
        RowSchema scope = source.withAliases(aliases);

        if (!query.orderBy().isEmpty()) {
            List<SortOperator.SortKey> keys = new ArrayList<>();
            for (OrderItem o : query.orderBy()) {
                keys.add(new SortOperator.SortKey(scope.indexOf((ColumnRef) o.expression()), o.descending()));
            }
            root = new SortOperator(root, keys);
        }

        int[] indexes;
        List<String> names = new ArrayList<>();
        if (query.isStar()) {
            indexes = new int[source.size()];
            for (int i = 0; i < source.size(); i++) {
                OutputColumn c = source.column(i);
                indexes[i] = i;
                names.add(query.join() != null ? c.qualifiedName() : c.name());
            }
        } else {
            indexes = new int[query.items().size()];
            for (int i = 0; i < indexes.length; i++) {
                SelectItem item = query.items().get(i);
                indexes[i] = source.indexOf((ColumnRef) item.expression());
                names.add(item.outputName());
            }
        }
        return new SelectPlan(new ProjectionOperator(root, indexes), names);
    }

    // ---- aggregated path: group, HAVING, sort on the aggregate layout, then project ----

    private SelectPlan planAggregated(SelectQuery query, Operator root) {
        RowSchema source = root.schema();
        if (query.isStar()) {
            throw new AmbiguousAggregationException("SELECT * cannot be combined with aggregate functions or GROUP BY");
        }
        int[] groupIndexes = new int[query.groupBy().size()];
        Set<Integer> grouped = new HashSet<>();
        for (int i = 0; i < groupIndexes.length; i++) {
            groupIndexes[i] = source.indexOf(query.groupBy().get(i));
            grouped.add(groupIndexes[i]);
        }
        for (SelectItem item : query.items()) {
            if (item.isAggregate()) continue;
            ColumnRef ref = (ColumnRef) item.expression();
            if (!grouped.contains(source.indexOf(ref))) throw notGrouped(ref);
        }

        List<AggregateCall> aggregates = new ArrayList<>();
        for (SelectItem item : query.items()) addAggregates(aggregates, item.expression());
        addAggregates(aggregates, query.having());
        for (OrderItem o : query.orderBy()) addAggregates(aggregates, o.expression());
        for (AggregateCall call : aggregates) checkArgument(call, source);

        AggregateOperator aggregate = new AggregateOperator(root, groupIndexes, aggregates);
        root = aggregate;
        RowSchema out = aggregate.schema();
        Map<String, Integer> aliases = new LinkedHashMap<>();
        for (SelectItem item : query.items()) {
            if (item.alias() != null) aliases.put(item.alias(), outputIndex(out, item.expression(), source));
        }
        RowSchema scope = out.withAliases(aliases);

        if (query.having() != null) {
            for (ColumnRef ref : Expressions.columns(query.having())) outputIndex(scope, ref, source);
            root = new FilterOperator(root, predicateCompiler.compile(query.having(), scope));
        }

        if (!query.orderBy().isEmpty()) {
            List<SortOperator.SortKey> keys = new ArrayList<>();
            for (OrderItem o : query.orderBy()) {
                keys.add(new SortOperator.SortKey(outputIndex(scope, o.expression(), source), o.descending()));
            }
            root = new SortOperator(root, keys);
        }

        int[] indexes = new int[query.items().size()];
        List<String> names = new ArrayList<>();
        for (int i = 0; i < indexes.length; i++) {
            SelectItem item = query.items().get(i);
            indexes[i] = outputIndex(out, item.expression(), source);
            names.add(item.outputName());
        }
        return new SelectPlan(new ProjectionOperator(root, indexes), names);
    }

    private static void addAggregates(List<AggregateCall> into, Expression e) {
        for (AggregateCall call : Expressions.aggregates(e)) {
            if (!into.contains(call)) into.add(call);
        }
    }

    private static void checkArgument(AggregateCall call, RowSchema source) {
        if (call.isStar()) return;
        DataType type = source.column(source.indexOf(call.argument())).type();
        boolean numericOnly = call.function() == AggregateFunction.SUM || call.function() == AggregateFunction.AVG;
        if (numericOnly && !type.isNumeric()) {
            throw new TypeMismatchException(call.function() + " requires a numeric column, '"
                + call.argument() + "' is " + type);
        }
    }

    // Position in the aggregate output; a source column that is not grouped is ambiguous there.
    private static int outputIndex(RowSchema scope, Expression e, RowSchema source) {
        if (e instanceof AggregateCall call) return scope.indexOf(call);
        ColumnRef ref = (ColumnRef) e;
        boolean aliased = ref.table() == null && scope.hasAlias(ref.column());
        if (scope.find(ref) < 0 && !aliased && source.find(ref) >= 0) {
            throw notGrouped(ref);
        }
        return scope.indexOf(ref);
    }

    private static AmbiguousAggregationException notGrouped(ColumnRef ref) {
        return new AmbiguousAggregationException("Column '" + ref
            + "' must appear in GROUP BY or be used inside an aggregate function");
    }
}
