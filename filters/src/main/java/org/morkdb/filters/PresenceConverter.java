package org.morkdb.filters;

/**
 * Field that signals "true" by being present at all; the stored value is
 * irrelevant.
 */
public final class PresenceConverter implements FieldConverter {

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }
        return "true";
    }
}
