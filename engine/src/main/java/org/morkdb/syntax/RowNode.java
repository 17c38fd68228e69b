package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A row, either at top level or inline in a table body.
 *
 * Mork syntax:
 * <pre>
 * [-1:^80 [(k=v)] (^81=hello)(^82^90)]
 * </pre>
 *
 * @param id        The row identifier
 * @param cells     The row's cells in source order
 * @param truncated Whether the row was written with a leading minus (replace all cells)
 * @param cut       Whether a table entry removes this row (minus before the bracket)
 * @param meta      Meta-rows attached to the row
 */
public record RowNode(
        ObjectId id,
        List<CellNode> cells,
        boolean truncated,
        boolean cut,
        List<MetaNode> meta
) implements MorkItem, TableEntry {

    public RowNode {
        Objects.requireNonNull(id, "Row id cannot be null");
        Objects.requireNonNull(cells, "Cells cannot be null");
        Objects.requireNonNull(meta, "Meta cannot be null");
        cells = List.copyOf(cells);
        meta = List.copyOf(meta);
    }

    /**
     * Creates a plain row with no edit markers.
     */
    public RowNode(ObjectId id, List<CellNode> cells) {
        this(id, cells, false, false, List.of());
    }

    /**
     * @return A copy of this row marked as cut from its enclosing table
     */
    public RowNode asCut() {
        return new RowNode(id, cells, truncated, true, meta);
    }
}
