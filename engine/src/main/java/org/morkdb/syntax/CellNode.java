package org.morkdb.syntax;

import java.util.Objects;

/**
 * A cell: <code>(column=value)</code> or <code>(^col^val)</code>.
 *
 * @param column The column, literal or symbolic
 * @param value  The value, literal or symbolic
 * @param cut    Whether the cell was written with a leading minus
 */
public record CellNode(CellText column, CellText value, boolean cut) {

    public CellNode {
        Objects.requireNonNull(column, "Column cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public CellNode(CellText column, CellText value) {
        this(column, value, false);
    }

    /**
     * Creates a cell whose column and value are both literal text.
     */
    public static CellNode literal(String column, String value) {
        return new CellNode(new CellText.Literal(column), new CellText.Literal(value));
    }
}
