package org.morkdb.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Store of rows or tables keyed by (namespace, id).
 *
 * A key holds at most one entity; storing under an existing key replaces the
 * previous entity wholesale. Enumeration follows first-definition order.
 *
 * @param <T> The stored entity type
 */
public final class ObjectStore<T> {

    private final Map<String, Map<String, T>> store = new LinkedHashMap<>();
    private int size;

    /**
     * Stores an entity, replacing any entity already under the key.
     *
     * @return The replaced entity, if there was one
     */
    public Optional<T> put(ObjectKey key, T value) {
        Objects.requireNonNull(value, "Stored value cannot be null");
        T previous = store.computeIfAbsent(key.namespace(), ns -> new LinkedHashMap<>())
                .put(key.id(), value);
        if (previous == null) {
            size++;
        }
        return Optional.ofNullable(previous);
    }

    public Optional<T> find(ObjectKey key) {
        return find(key.namespace(), key.id());
    }

    public Optional<T> find(String namespace, String id) {
        Map<String, T> objects = store.get(namespace);
        return objects == null ? Optional.empty() : Optional.ofNullable(objects.get(id));
    }

    public boolean contains(ObjectKey key) {
        return find(key).isPresent();
    }

    public Set<String> namespaces() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /**
     * @return Snapshot of all (key, entity) pairs, grouped by namespace
     */
    public List<Entry<T>> entries() {
        List<Entry<T>> entries = new ArrayList<>(size);
        for (var byNamespace : store.entrySet()) {
            for (var byId : byNamespace.getValue().entrySet()) {
                entries.add(new Entry<>(new ObjectKey(byNamespace.getKey(), byId.getKey()), byId.getValue()));
            }
        }
        return entries;
    }

    public Set<ObjectKey> keys() {
        Set<ObjectKey> keys = new LinkedHashSet<>();
        for (Entry<T> entry : entries()) {
            keys.add(entry.key());
        }
        return keys;
    }

    public int size() {
        return size;
    }

    /**
     * One stored entity with its key.
     */
    public record Entry<T>(ObjectKey key, T value) {
        public String namespace() {
            return key.namespace();
        }

        public String id() {
            return key.id();
        }
    }
}
