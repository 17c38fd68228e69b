package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A meta-dict, meta-row or meta-table annotation.
 *
 * @param cells Annotation cells
 * @param rows  Rows nested in a meta-table; empty for other meta kinds
 */
public record MetaNode(List<CellNode> cells, List<RowNode> rows) {

    public MetaNode {
        Objects.requireNonNull(cells, "Cells cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        cells = List.copyOf(cells);
        rows = List.copyOf(rows);
    }

    public MetaNode(List<CellNode> cells) {
        this(cells, List.of());
    }
}
