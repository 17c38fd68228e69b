package org.morkdb.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ObjectStoreTest {

    @Test
    void putAndFindByKey() {
        ObjectStore<MorkRow> store = new ObjectStore<>();
        MorkRow row = new MorkRow(Map.of("subject", "hi"));

        assertTrue(store.put(new ObjectKey("m", "1"), row).isEmpty());

        assertSame(row, store.find("m", "1").orElseThrow());
        assertTrue(store.contains(new ObjectKey("m", "1")));
        assertFalse(store.contains(new ObjectKey("m", "2")));
        assertFalse(store.contains(new ObjectKey("n", "1")));
        assertEquals(1, store.size());
    }

    @Test
    void sameIdInDifferentNamespacesAreDistinct() {
        ObjectStore<String> store = new ObjectStore<>();
        store.put(new ObjectKey("a", "1"), "in a");
        store.put(new ObjectKey("b", "1"), "in b");

        assertEquals("in a", store.find("a", "1").orElseThrow());
        assertEquals("in b", store.find("b", "1").orElseThrow());
        assertEquals(2, store.size());
    }

    @Test
    void putReplacesWholesale() {
        ObjectStore<String> store = new ObjectStore<>();
        ObjectKey key = new ObjectKey("m", "1");
        store.put(key, "old");

        Optional<String> previous = store.put(key, "new");

        assertEquals(Optional.of("old"), previous);
        assertEquals("new", store.find(key).orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void entriesFollowFirstDefinitionOrder() {
        ObjectStore<String> store = new ObjectStore<>();
        store.put(new ObjectKey("m", "2"), "two");
        store.put(new ObjectKey("m", "1"), "one");
        store.put(new ObjectKey("m", "2"), "two again");

        List<ObjectStore.Entry<String>> entries = store.entries();
        assertEquals(2, entries.size());
        assertEquals("2", entries.get(0).id());
        assertEquals("two again", entries.get(0).value());
        assertEquals("1", entries.get(1).id());
        assertEquals("m", entries.get(1).namespace());
    }
}
