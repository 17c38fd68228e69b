package org.morkdb.model;

/**
 * Exception thrown when a Mork store is structurally corrupt and cannot be
 * interpreted: undefined references, rows or tables without a namespace,
 * repeated meta-dictionaries, or tables naming rows that do not exist yet.
 *
 * A database whose build failed this way must not be used.
 */
public class MorkBuildException extends RuntimeException {

    public MorkBuildException(String message) {
        super("cannot interpret file: " + message);
    }

    public MorkBuildException(String message, Throwable cause) {
        super("cannot interpret file: " + message, cause);
    }
}
