package org.morkdb.filters;

/**
 * Exception thrown when a known field holds a value its converter cannot
 * interpret.
 */
public class FieldConversionException extends RuntimeException {

    private final String namespace;
    private final String column;
    private final String value;

    public FieldConversionException(String namespace, String column, String value, Throwable cause) {
        super("cannot convert field '" + column + "' of " + namespace + " with value '" + value + "': "
                + cause.getMessage(), cause);
        this.namespace = namespace;
        this.column = column;
        this.value = value;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}
