package org.morkdb.model;

import java.util.List;
import java.util.Objects;

/**
 * A resolved table: the keys of its rows in body order.
 *
 * Rows are owned by the row store; a table only refers to them, so a row
 * listed by several tables is a single shared row.
 *
 * @param rowKeys Keys into the row store, duplicates kept as written
 */
public record MorkTable(List<ObjectKey> rowKeys) {

    public MorkTable {
        Objects.requireNonNull(rowKeys, "Row keys cannot be null");
        rowKeys = List.copyOf(rowKeys);
    }

    public int size() {
        return rowKeys.size();
    }
}
