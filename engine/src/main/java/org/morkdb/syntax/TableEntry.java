package org.morkdb.syntax;

import java.util.Objects;

/**
 * One entry of a table body: a bare row identifier or an inline row.
 */
public sealed interface TableEntry permits RowNode, TableEntry.RowReference {

    /**
     * A bare row identifier naming a row defined earlier.
     *
     * @param id  The referenced row's identifier
     * @param cut Whether the entry was written with a leading minus
     */
    record RowReference(ObjectId id, boolean cut) implements TableEntry {
        public RowReference {
            Objects.requireNonNull(id, "Row id cannot be null");
        }

        public RowReference(ObjectId id) {
            this(id, false);
        }
    }
}
