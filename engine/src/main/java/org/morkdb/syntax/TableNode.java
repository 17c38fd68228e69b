package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A table item.
 *
 * Mork syntax:
 * <pre>
 * {1:^80 {(k=v)} 1 -2 [3 (^81=x)]}
 * </pre>
 *
 * @param id        The table identifier
 * @param entries   Row references and inline rows, in body order
 * @param truncated Whether the table was written with a leading minus
 * @param meta      Meta-tables attached to the table
 */
public record TableNode(
        ObjectId id,
        List<TableEntry> entries,
        boolean truncated,
        List<MetaNode> meta
) implements MorkItem {

    public TableNode {
        Objects.requireNonNull(id, "Table id cannot be null");
        Objects.requireNonNull(entries, "Entries cannot be null");
        Objects.requireNonNull(meta, "Meta cannot be null");
        entries = List.copyOf(entries);
        meta = List.copyOf(meta);
    }

    public TableNode(ObjectId id, List<TableEntry> entries) {
        this(id, entries, false, List.of());
    }
}
