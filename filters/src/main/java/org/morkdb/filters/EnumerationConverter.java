package org.morkdb.filters;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Integer code displayed as a symbolic name.
 *
 * An empty stored value maps to the default. Codes without a name (and no
 * default) are left unconverted.
 *
 * @param names        Code to name
 * @param defaultValue Name for empty or unknown codes, or null to keep the value
 * @param radix        The stored radix
 */
public record EnumerationConverter(Map<Long, String> names, String defaultValue, int radix)
        implements FieldConverter {

    public EnumerationConverter {
        Objects.requireNonNull(names, "Names cannot be null");
        names = Map.copyOf(names);
    }

    /**
     * Names indexed by code 0, 1, 2...; null entries are codes without a name.
     */
    public static EnumerationConverter of(String... names) {
        return withDefault(null, names);
    }

    public static EnumerationConverter withDefault(String defaultValue, String... names) {
        Map<Long, String> byCode = new HashMap<>();
        for (int code = 0; code < names.length; code++) {
            if (names[code] != null) {
                byCode.put((long) code, names[code]);
            }
        }
        return new EnumerationConverter(byCode, defaultValue, 16);
    }

    /**
     * 0 and 1 as "false" and "true".
     */
    public static EnumerationConverter bool() {
        return of("false", "true");
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }

        String result = value.isEmpty()
                ? defaultValue
                : names.getOrDefault(IntConverter.parse(value, radix), defaultValue);
        return result == null ? value : result;
    }
}
