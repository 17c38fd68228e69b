package org.morkdb.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-namespace alias tables.
 *
 * Dictionaries only grow: a merge into an existing namespace overlays its
 * entries alias by alias, the later value winning. Nothing is ever removed.
 */
public final class DictionaryStore {

    private final DictionarySeed seed;
    private final Map<String, Map<String, String>> dictionaries = new LinkedHashMap<>();

    public DictionaryStore() {
        this(DictionarySeed.DEFAULT);
    }

    public DictionaryStore(DictionarySeed seed) {
        this.seed = Objects.requireNonNull(seed, "Seed cannot be null");
        for (String namespace : seed.namespaces()) {
            dictionaries.put(namespace, seed.identityTable());
        }
    }

    /**
     * Looks up an alias.
     *
     * @param namespace The dictionary namespace
     * @param alias     The alias id
     * @return The decoded literal the alias stands for
     * @throws MorkLookupException if the namespace or the alias is undefined
     */
    public String get(String namespace, String alias) {
        Map<String, String> dictionary = dictionaries.get(namespace);
        if (dictionary == null) {
            throw new MorkLookupException(namespace, null,
                    "dictionary namespace '" + namespace + "' is not defined");
        }
        String value = dictionary.get(alias);
        if (value == null) {
            throw new MorkLookupException(namespace, alias,
                    "alias '" + alias + "' is not defined in dictionary '" + namespace + "'");
        }
        return value;
    }

    /**
     * Creates the namespace (seeded) if needed, then overlays the entries.
     */
    public void merge(String namespace, Map<String, String> entries) {
        Objects.requireNonNull(namespace, "Namespace cannot be null");
        dictionaries.computeIfAbsent(namespace, ns -> seed.identityTable()).putAll(entries);
    }

    public boolean hasNamespace(String namespace) {
        return dictionaries.containsKey(namespace);
    }

    public Set<String> namespaces() {
        return Collections.unmodifiableSet(dictionaries.keySet());
    }

    /**
     * @return Read-only view of one dictionary
     * @throws MorkLookupException if the namespace is undefined
     */
    public Map<String, String> dictionary(String namespace) {
        Map<String, String> dictionary = dictionaries.get(namespace);
        if (dictionary == null) {
            throw new MorkLookupException(namespace, null,
                    "dictionary namespace '" + namespace + "' is not defined");
        }
        return Collections.unmodifiableMap(dictionary);
    }
}
