package org.morkdb.model;

import java.util.Objects;

/**
 * Identity of a row or table: its resolved namespace and raw id.
 *
 * @param namespace The resolved namespace name (e.g., "ns:msg:db:row:scope:msgs:all")
 * @param id        The raw object id (e.g., "1A")
 */
public record ObjectKey(String namespace, String id) {

    public ObjectKey {
        Objects.requireNonNull(namespace, "Namespace cannot be null");
        Objects.requireNonNull(id, "Id cannot be null");
    }

    @Override
    public String toString() {
        return id + ":" + namespace;
    }
}
