package db.pesa.storage;

/**
 * Row identifier: stable identity of a row within its table. Ids grow monotonically,
 * so ordering by id is table (insertion) order.
 */
public record RID(long id) implements Comparable<RID> {
    @Override
    public int compareTo(RID other) { return Long.compare(id, other.id); }

    @Override
    public String toString() {
        // For debugging
        return "#" + id;
    }
}
