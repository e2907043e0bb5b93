package db.pesa.index;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;

import org.junit.jupiter.api.Test;

import db.pesa.storage.RID;

public class HashIndexTest {

    @Test
    void addLookupRemove() {
        HashIndex idx = new HashIndex("user_id", 1, false);
        idx.add(7L, new RID(1));
        idx.add(7L, new RID(2));
        idx.add(8L, new RID(3));
        assertEquals(Set.of(new RID(1), new RID(2)), idx.lookup(7L));
        assertEquals(3, idx.size());
        idx.remove(7L, new RID(1));
        assertEquals(Set.of(new RID(2)), idx.lookup(7L));
        idx.remove(7L, new RID(2));
        assertFalse(idx.contains(7L));
        assertEquals(Set.of(8L), idx.keys());
        assertTrue(idx.lookup(99L).isEmpty());
    }

    @Test
    void uniqueConflictIgnoresSelfAndNull() {
        HashIndex idx = new HashIndex("email", 2, true);
        idx.add("a@x", new RID(1));
        idx.add(null, new RID(2));
        assertTrue(idx.conflicts("a@x", new RID(5)));
        assertFalse(idx.conflicts("a@x", new RID(1)));
        assertFalse(idx.conflicts(null, new RID(5)));
        assertFalse(idx.conflicts("b@x", new RID(5)));
        assertTrue(idx.keys().contains(null));
    }
}
