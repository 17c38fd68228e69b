package org.morkdb.model;

/**
 * Thrown when a dictionary namespace or alias is not defined.
 */
public class MorkLookupException extends MorkBuildException {

    private final String namespace;
    private final String alias;

    public MorkLookupException(String namespace, String alias, String message) {
        super(message);
        this.namespace = namespace;
        this.alias = alias;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @return The alias that failed to resolve, or null when the namespace itself is missing
     */
    public String getAlias() {
        return alias;
    }
}
