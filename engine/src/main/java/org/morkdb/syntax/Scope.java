package org.morkdb.syntax;

import java.util.Objects;

/**
 * The scope (namespace) part of an object identifier.
 */
public sealed interface Scope permits Scope.Named, ObjectRef {

    /**
     * A namespace written out literally, as in <code>[1:m]</code>.
     *
     * @param name The namespace name
     */
    record Named(String name) implements Scope {
        public Named {
            Objects.requireNonNull(name, "Scope name cannot be null");
        }
    }
}
