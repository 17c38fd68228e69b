package org.morkdb.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Initial contents of a {@link DictionaryStore}.
 *
 * Every seeded namespace starts with the identity table: alias "00".."XX"
 * (two or more uppercase hex digits) maps to the one-character string of
 * that code point, for all code points below {@code limit}. New namespaces
 * created by a merge start from the same table.
 *
 * @param namespaces Namespaces that exist before any dictionary item
 * @param limit      Exclusive upper bound of the identity range, at most 0x100
 */
public record DictionarySeed(Set<String> namespaces, int limit) {

    /**
     * Namespaces "a" (values) and "c" (columns), seeded with 0x00..0x7F.
     */
    public static final DictionarySeed DEFAULT = new DictionarySeed(Set.of("a", "c"), 0x80);

    public DictionarySeed {
        Objects.requireNonNull(namespaces, "Namespaces cannot be null");
        namespaces = Set.copyOf(namespaces);
        if (limit < 0 || limit > 0x100) {
            throw new IllegalArgumentException("Seed limit must be within 0..0x100, was " + limit);
        }
    }

    /**
     * @return A fresh, mutable identity table
     */
    public Map<String, String> identityTable() {
        Map<String, String> table = new LinkedHashMap<>();
        for (int code = 0; code < limit; code++) {
            table.put(String.format("%02X", code), String.valueOf((char) code));
        }
        return table;
    }
}
