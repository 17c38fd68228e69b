package org.morkdb.filters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Bit set displayed as a space-separated list of flag names.
 *
 * Bit i is named by entry i of the name list; null entries are bits without
 * a known name. Bits set but not named are reported and dropped.
 */
public class FlagsConverter implements FieldConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlagsConverter.class);

    private final List<String> names;
    private final String empty;
    private final int radix;

    public FlagsConverter(List<String> names, String empty, int radix) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.empty = empty;
        this.radix = radix;
    }

    public FlagsConverter(String empty, String... names) {
        this(Arrays.asList(names), empty, 16);
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }
        return join(decodeFlags(parse(value)));
    }

    protected long parse(String value) {
        return IntConverter.parse(value, radix);
    }

    /**
     * @return Names of the named bits set in {@code bits}, lowest bit first
     */
    protected List<String> decodeFlags(long bits) {
        List<String> flags = new ArrayList<>();
        long remaining = bits;
        for (int i = 0; i < names.size() && i < Long.SIZE; i++) {
            String name = names.get(i);
            long bit = 1L << i;
            if (name != null && (remaining & bit) != 0) {
                flags.add(name);
                remaining &= ~bit;
            }
        }
        if (remaining != 0) {
            LOGGER.warn("unknown flags: {}", Long.toHexString(remaining));
        }
        return flags;
    }

    protected String join(List<String> flags) {
        return flags.isEmpty() ? empty : String.join(" ", flags);
    }
}
