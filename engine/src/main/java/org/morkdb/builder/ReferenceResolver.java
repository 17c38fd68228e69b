package org.morkdb.builder;

import org.morkdb.model.DictionaryStore;
import org.morkdb.model.MorkLookupException;
import org.morkdb.model.ObjectKey;
import org.morkdb.syntax.CellNode;
import org.morkdb.syntax.CellText;
import org.morkdb.syntax.ObjectId;
import org.morkdb.syntax.ObjectRef;
import org.morkdb.syntax.Scope;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves identifiers and cells against the dictionaries defined so far.
 *
 * A symbolic reference is looked up in its own namespace when it carries one,
 * otherwise in a context default: "c" for columns and identifier scopes, "a"
 * for cell values. An identifier whose scope is symbolic lives in the
 * namespace named by the looked-up value, e.g. <code>3:^85</code> with
 * c[85] = "history" lives in namespace "history".
 */
public final class ReferenceResolver {

    /** Default dictionary for column references and identifier scopes. */
    public static final String COLUMN_NAMESPACE = "c";

    /** Default dictionary for value references. */
    public static final String VALUE_NAMESPACE = "a";

    private final DictionaryStore dictionaries;

    public ReferenceResolver(DictionaryStore dictionaries) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "Dictionaries cannot be null");
    }

    /**
     * Resolves the namespace of an identifier.
     *
     * @return The namespace, or empty when the identifier has no scope
     * @throws MorkLookupException if a symbolic scope cannot be resolved
     */
    public Optional<String> resolveNamespace(ObjectId id) {
        Scope scope = id.scope();
        if (scope == null) {
            return Optional.empty();
        }
        if (scope instanceof Scope.Named named) {
            return Optional.of(named.name());
        }
        return Optional.of(dereference((ObjectRef) scope, COLUMN_NAMESPACE));
    }

    /**
     * Resolves an identifier to a store key.
     *
     * @param defaultNamespace Namespace used when the identifier has no scope; may be null
     * @return The key, or empty when no namespace could be determined
     */
    public Optional<ObjectKey> resolveKey(ObjectId id, String defaultNamespace) {
        return resolveNamespace(id)
                .or(() -> Optional.ofNullable(defaultNamespace))
                .map(namespace -> new ObjectKey(namespace, id.id()));
    }

    /**
     * Looks up a symbolic reference.
     *
     * @param defaultNamespace Dictionary to use when the reference names none
     * @throws MorkLookupException if the namespace or alias is undefined
     */
    public String dereference(ObjectRef ref, String defaultNamespace) {
        String namespace = resolveNamespace(ref.target()).orElse(defaultNamespace);
        return dictionaries.get(namespace, ref.target().id());
    }

    public String resolveColumn(CellText column) {
        return resolveText(column, COLUMN_NAMESPACE);
    }

    public String resolveValue(CellText value) {
        return resolveText(value, VALUE_NAMESPACE);
    }

    /**
     * Resolves both halves of a cell independently.
     */
    public ResolvedCell resolveCell(CellNode cell) {
        return new ResolvedCell(resolveColumn(cell.column()), resolveValue(cell.value()));
    }

    private String resolveText(CellText text, String defaultNamespace) {
        if (text instanceof CellText.Literal literal) {
            return EscapeDecoder.decode(literal.raw());
        }
        return dereference((ObjectRef) text, defaultNamespace);
    }

    /**
     * A cell with its column and value decoded.
     */
    public record ResolvedCell(String column, String value) {
    }
}
