package db.pesa.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored row values in schema column order. Immutable: UPDATE swaps in a new Record under the same RID.
 * Values are NULL, Long, Double, String or Boolean.
 */
public class Record {
    private final List<Object> values;

    public Record(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() { return values.size(); }

    @Override
    public boolean equals(Object o) {
        return o instanceof Record r && values.equals(r.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() {
        return values.toString();
    }
}
