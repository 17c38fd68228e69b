package org.morkdb.model;

/**
 * Thrown when a table refers to a row that has not been built yet.
 * Rows must precede the tables that reference them.
 */
public class MissingRowException extends MorkBuildException {

    private final ObjectKey rowKey;
    private final ObjectKey tableKey;

    public MissingRowException(ObjectKey rowKey, ObjectKey tableKey) {
        super("row " + rowKey + " referenced by table " + tableKey + " not found");
        this.rowKey = rowKey;
        this.tableKey = tableKey;
    }

    public ObjectKey getRowKey() {
        return rowKey;
    }

    public ObjectKey getTableKey() {
        return tableKey;
    }
}
