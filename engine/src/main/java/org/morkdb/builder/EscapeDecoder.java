package org.morkdb.builder;

/**
 * Decodes the escapes of Mork literal text.
 *
 * <pre>
 * $XX         the character with hex byte value XX
 * \ CR LF     line continuation, removed
 * \ LF        line continuation, removed
 * \x          the character x (covers \) \\ and \$)
 * </pre>
 *
 * Input is scanned once, left to right. Anything else, including a '$' not
 * followed by two hex digits and a trailing lone backslash, is copied as is.
 */
public final class EscapeDecoder {

    private EscapeDecoder() {
        // Static utility class
    }

    public static String decode(String raw) {
        if (raw.indexOf('$') < 0 && raw.indexOf('\\') < 0) {
            return raw;
        }

        StringBuilder out = new StringBuilder(raw.length());
        int length = raw.length();
        int i = 0;
        while (i < length) {
            char c = raw.charAt(i);
            if (c == '$' && i + 2 < length && isHex(raw.charAt(i + 1)) && isHex(raw.charAt(i + 2))) {
                out.append((char) Integer.parseInt(raw.substring(i + 1, i + 3), 16));
                i += 3;
            } else if (c == '\\' && i + 1 < length) {
                char next = raw.charAt(i + 1);
                if (next == '\r' && i + 2 < length && raw.charAt(i + 2) == '\n') {
                    i += 3;
                } else if (next == '\n') {
                    i += 2;
                } else {
                    out.append(next);
                    i += 2;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }
}
