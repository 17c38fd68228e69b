package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A dictionary item.
 *
 * Mork syntax:
 * <pre>
 * &lt; &lt;(a=c)&gt; (80=subject)(81=date) &gt;
 * </pre>
 *
 * @param cells Alias definitions; the column is the alias, the value its literal text
 * @param meta  Meta-dictionaries; a well-formed dict has at most one
 */
public record DictNode(List<CellNode> cells, List<MetaNode> meta) implements MorkItem {

    public DictNode {
        Objects.requireNonNull(cells, "Cells cannot be null");
        Objects.requireNonNull(meta, "Meta cannot be null");
        cells = List.copyOf(cells);
        meta = List.copyOf(meta);
    }

    public DictNode(List<CellNode> cells) {
        this(cells, List.of());
    }
}
