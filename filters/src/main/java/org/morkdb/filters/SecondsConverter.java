package org.morkdb.filters;

import java.time.Instant;

/**
 * Epoch-based time, displayed with the configured format and zone.
 *
 * @param radix   The stored radix
 * @param divisor Units per second (1 for seconds, 1000000 for microseconds)
 */
public record SecondsConverter(int radix, long divisor) implements FieldConverter {

    public static final SecondsConverter SECONDS = new SecondsConverter(10, 1);
    public static final SecondsConverter HEX_SECONDS = new SecondsConverter(16, 1);
    public static final SecondsConverter MICROSECONDS = new SecondsConverter(10, 1_000_000);

    public SecondsConverter {
        if (divisor <= 0) {
            throw new IllegalArgumentException("Divisor must be positive, was " + divisor);
        }
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noTime()) {
            return value;
        }
        // 0 is common and is not a real time
        if (value.equals("0")) {
            return value;
        }

        long seconds = IntConverter.parse(value, radix) / divisor;
        return options.formatter().format(Instant.ofEpochSecond(seconds).atZone(options.zone()));
    }
}
