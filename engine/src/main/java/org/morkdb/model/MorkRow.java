package org.morkdb.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A resolved row: column name to value, both fully decoded.
 *
 * The set of columns is fixed when the row is built. Values of existing
 * columns may be rewritten in place by field conversion; every table that
 * references the row sees the rewritten value.
 */
public final class MorkRow {

    private final Map<String, String> cells;

    public MorkRow(Map<String, String> cells) {
        Objects.requireNonNull(cells, "Cells cannot be null");
        this.cells = new LinkedHashMap<>(cells);
    }

    public Set<String> columnNames() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    public Optional<String> get(String column) {
        return Optional.ofNullable(cells.get(column));
    }

    /**
     * @return Read-only view of the cells in column order
     */
    public Map<String, String> cells() {
        return Collections.unmodifiableMap(cells);
    }

    public int size() {
        return cells.size();
    }

    /**
     * Rewrites the value of an existing column.
     *
     * @throws IllegalArgumentException if the row has no such column
     */
    public void setValue(String column, String value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (!cells.containsKey(column)) {
            throw new IllegalArgumentException("Row has no column '" + column + "'");
        }
        cells.put(column, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MorkRow other && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "MorkRow" + cells;
    }
}
