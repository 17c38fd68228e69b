package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed Mork store: the top-level items in file order.
 *
 * @param items Dicts, rows, tables and groups exactly as they appear in the source
 */
public record MorkDocument(List<MorkItem> items) {

    public MorkDocument {
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }
}
