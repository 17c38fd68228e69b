package org.morkdb.filters;

/**
 * Integer stored in some radix, displayed in decimal.
 *
 * @param radix    The stored radix, usually 16
 * @param signed32 Whether the stored value is a 32-bit two's-complement integer
 */
public record IntConverter(int radix, boolean signed32) implements FieldConverter {

    public static final IntConverter HEX = new IntConverter(16, false);
    public static final IntConverter SIGNED_HEX32 = new IntConverter(16, true);

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noBase()) {
            return value;
        }

        long number = parse(value, radix);
        if (signed32) {
            if (number > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("integer too large for 32 bits: " + value);
            }
            if (number > 0x7FFFFFFFL) {
                number -= 0x100000000L;
            }
        }
        return Long.toString(number);
    }

    static long parse(String value, int radix) {
        return Long.parseLong(value.trim(), radix);
    }
}
