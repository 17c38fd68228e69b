package org.morkdb.syntax;

import java.util.Objects;

/**
 * An object identifier: a raw id with an optional scope.
 *
 * <pre>
 * 1          no scope, the context decides
 * 1:m        literal namespace "m"
 * 1:^80      namespace is whatever alias 80 means in dictionary "c"
 * </pre>
 *
 * @param id    The raw id text
 * @param scope The scope, or null when none was written
 */
public record ObjectId(String id, Scope scope) {

    public ObjectId {
        Objects.requireNonNull(id, "Object id cannot be null");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Object id cannot be empty");
        }
    }

    public ObjectId(String id) {
        this(id, null);
    }

    public boolean hasScope() {
        return scope != null;
    }

    @Override
    public String toString() {
        if (scope == null) {
            return id;
        }
        if (scope instanceof Scope.Named named) {
            return id + ":" + named.name();
        }
        return id + ":^" + ((ObjectRef) scope).target();
    }
}
