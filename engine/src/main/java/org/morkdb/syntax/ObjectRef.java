package org.morkdb.syntax;

import java.util.Objects;

/**
 * A symbolic reference: <code>^80</code>, optionally scoped as <code>^80:a</code>.
 *
 * Used both as cell text and as the scope of an identifier. The target's own
 * scope, when present, names the dictionary to look the alias up in.
 *
 * @param target The alias id with its optional dictionary namespace
 */
public record ObjectRef(ObjectId target) implements CellText, Scope {

    public ObjectRef {
        Objects.requireNonNull(target, "Reference target cannot be null");
    }

    /**
     * Creates an unscoped reference to the given alias.
     */
    public static ObjectRef to(String alias) {
        return new ObjectRef(new ObjectId(alias));
    }

    /**
     * Creates a reference to the given alias in an explicit dictionary namespace.
     */
    public static ObjectRef to(String alias, String namespace) {
        return new ObjectRef(new ObjectId(alias, new Scope.Named(namespace)));
    }
}
