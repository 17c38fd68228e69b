package org.morkdb.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dictionary store")
class DictionaryStoreTest {

    @Nested
    @DisplayName("Seeding")
    class Seeding {

        @Test
        void defaultNamespacesExistBeforeAnyMerge() {
            DictionaryStore store = new DictionaryStore();
            assertEquals(Set.of("a", "c"), store.namespaces());
        }

        @Test
        void identityTableCoversAsciiRange() {
            DictionaryStore store = new DictionaryStore();
            assertEquals("(", store.get("a", "28"));
            assertEquals("(", store.get("c", "28"));
            assertEquals("\u0000", store.get("a", "00"));
            assertEquals("\u007f", store.get("a", "7F"));
            assertThrows(MorkLookupException.class, () -> store.get("a", "80"));
        }

        @Test
        void seedIsParameterized() {
            DictionaryStore store = new DictionaryStore(new DictionarySeed(Set.of("x"), 0x100));
            assertEquals(Set.of("x"), store.namespaces());
            assertEquals("ÿ", store.get("x", "FF"));
            assertFalse(store.hasNamespace("a"));
        }

        @Test
        void emptySeedHasNoAliases() {
            DictionaryStore store = new DictionaryStore(new DictionarySeed(Set.of("a"), 0));
            assertTrue(store.dictionary("a").isEmpty());
        }

        @Test
        void seedLimitIsValidated() {
            assertThrows(IllegalArgumentException.class, () -> new DictionarySeed(Set.of("a"), 0x101));
            assertThrows(IllegalArgumentException.class, () -> new DictionarySeed(Set.of("a"), -1));
        }
    }

    @Nested
    @DisplayName("Overlay merge")
    class OverlayMerge {

        @Test
        void laterEntriesWinPerAlias() {
            DictionaryStore store = new DictionaryStore();
            store.merge("a", Map.of("80", "first", "81", "kept"));
            store.merge("a", Map.of("80", "second", "82", "added"));

            assertEquals("second", store.get("a", "80"));
            assertEquals("kept", store.get("a", "81"));
            assertEquals("added", store.get("a", "82"));
        }

        @Test
        void resultEqualsUnionWithLaterWinning() {
            Map<String, String> first = Map.of("80", "x", "81", "y");
            Map<String, String> second = Map.of("81", "z", "90", "w");

            DictionaryStore store = new DictionaryStore();
            store.merge("a", first);
            store.merge("a", second);

            Map<String, String> expected = new LinkedHashMap<>(new DictionarySeed(Set.of(), 0x80).identityTable());
            expected.putAll(first);
            expected.putAll(second);
            assertEquals(expected, store.dictionary("a"));
        }

        @Test
        void overlayCanReplaceSeededAliases() {
            DictionaryStore store = new DictionaryStore();
            store.merge("c", Map.of("28", "paren"));
            assertEquals("paren", store.get("c", "28"));
            assertEquals("(", store.get("a", "28"));
        }

        @Test
        void mergeIntoNewNamespaceStartsFromSeed() {
            DictionaryStore store = new DictionaryStore();
            store.merge("m", Map.of("80", "meta"));

            assertTrue(store.hasNamespace("m"));
            assertEquals("meta", store.get("m", "80"));
            assertEquals("A", store.get("m", "41"));
        }
    }

    @Test
    void undefinedNamespaceFailsWithNamespaceOnly() {
        DictionaryStore store = new DictionaryStore();
        MorkLookupException e = assertThrows(MorkLookupException.class, () -> store.get("zz", "80"));
        assertEquals("zz", e.getNamespace());
        assertNull(e.getAlias());
        assertTrue(e.getMessage().startsWith("cannot interpret file"));
    }

    @Test
    void undefinedAliasReportsAlias() {
        DictionaryStore store = new DictionaryStore();
        MorkLookupException e = assertThrows(MorkLookupException.class, () -> store.get("a", "9F"));
        assertEquals("a", e.getNamespace());
        assertEquals("9F", e.getAlias());
    }

    @Test
    void dictionaryViewIsReadOnly() {
        DictionaryStore store = new DictionaryStore();
        assertThrows(UnsupportedOperationException.class, () -> store.dictionary("a").put("80", "x"));
    }
}
