package db.pesa.exec;

import db.pesa.catalog.DataType;
import db.pesa.expr.AggregateCall;
import db.pesa.expr.Values;

/**
 * Running state of one aggregate over one group. NULL inputs are skipped by everything except
 * COUNT(*); SUM/AVG/MIN/MAX of no values is NULL, COUNT of no values is 0.
 */
public abstract class Accumulator {

    public abstract void add(Object value);

    public abstract Object result();

    public static Accumulator create(AggregateCall call, DataType argumentType) {
        return switch (call.function()) {
            case COUNT -> call.isStar() ? new CountStar() : new Count();
            case SUM -> new Sum(argumentType == DataType.INT);
            case AVG -> new Avg();
            case MIN -> new Extreme(false);
            case MAX -> new Extreme(true);
        };
    }

    /** Declared type of the aggregate's result. */
    public static DataType resultType(AggregateCall call, DataType argumentType) {
        return switch (call.function()) {
            case COUNT -> DataType.INT;
            case AVG -> DataType.FLOAT;
            case SUM, MIN, MAX -> argumentType;
        };
    }

    static final class CountStar extends Accumulator {
        private long count;

        @Override public void add(Object value) { count++; }
        @Override public Object result() { return count; }
    }

    static final class Count extends Accumulator {
        private long count;

        @Override public void add(Object value) { if (value != null) count++; }
        @Override public Object result() { return count; }
    }

    static final class Sum extends Accumulator {
        private final boolean integral;
        private long longSum;
        private double doubleSum;
        private boolean seen;

        Sum(boolean integral) { this.integral = integral; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            Number n = (Number) value;
            if (integral) longSum = Math.addExact(longSum, n.longValue());
            else doubleSum += n.doubleValue();
            seen = true;
        }

        @Override
        public Object result() {
            if (!seen) return null;
            return integral ? (Object) longSum : (Object) doubleSum;
        }
    }

    static final class Avg extends Accumulator {
        private double sum;
        private long count;

        @Override
        public void add(Object value) {
            if (value == null) return;
            sum += ((Number) value).doubleValue();
            count++;
        }

        @Override
        public Object result() { return count == 0 ? null : sum / count; }
    }

    static final class Extreme extends Accumulator {
        private final boolean max;
        private Object best;

        Extreme(boolean max) { this.max = max; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            if (best == null) {
                best = value;
                return;
            }
            int c = Values.compare(value, best);
            if (max ? c > 0 : c < 0) best = value;
        }

        @Override
        public Object result() { return best; }
    }
}
