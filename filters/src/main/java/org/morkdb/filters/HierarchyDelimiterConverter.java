package org.morkdb.filters;

/**
 * IMAP hierarchy delimiter stored as a hex character code.
 */
public final class HierarchyDelimiterConverter implements FieldConverter {

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }

        long code = IntConverter.parse(value, 16);
        if (code < 0 || code > Character.MAX_CODE_POINT) {
            throw new IllegalArgumentException("invalid delimiter code point " + value);
        }
        int delimiter = (int) code;
        if (delimiter == '^') {
            return "kOnlineHierarchySeparatorUnknown";
        }
        if (delimiter == '|') {
            return "kOnlineHierarchySeparatorNil";
        }
        return Character.toString(delimiter);
    }
}
