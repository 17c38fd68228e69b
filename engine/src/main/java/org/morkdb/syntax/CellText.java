package org.morkdb.syntax;

import java.util.Objects;

/**
 * The column or value half of a cell.
 */
public sealed interface CellText permits CellText.Literal, ObjectRef {

    /**
     * Literal text, still carrying its source escapes.
     *
     * @param raw The undecoded text
     */
    record Literal(String raw) implements CellText {
        public Literal {
            Objects.requireNonNull(raw, "Literal text cannot be null");
        }
    }
}
