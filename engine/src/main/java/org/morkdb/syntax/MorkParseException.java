package org.morkdb.syntax;

/**
 * Exception thrown when Mork text cannot be parsed.
 * Carries the source location of the first syntax error when one is known.
 */
public class MorkParseException extends RuntimeException {

    private final int line;
    private final int column;

    public MorkParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public MorkParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
