package org.morkdb.filters;

import java.util.Arrays;
import java.util.List;

/**
 * Message flags (nsMsgMessageFlags). The word also packs a priority in bits
 * 13-15 and a label in bits 25-27, shown as "Priorities:x" and "Labels:0xN".
 */
public final class MessageFlagsConverter extends FlagsConverter {

    private static final List<String> FLAG_NAMES = Arrays.asList(
            "Read", "Replied", "Marked", "Expunged", "HasRe",
            "Elided", null, "Offline", "Watched", "SenderAuthed",
            "Partial", "Queued", "Forwarded", null, null, null,
            "New", null, "Ignored", null, null, "IMAPDeleted",
            "MDNReportNeeded", "MDNReportSent", "Template",
            null, null, null, "Attachment");

    static final List<String> PRIORITY_LABELS = List.of(
            "notSet", "none", "lowest", "low", "normal", "high", "highest");

    private static final long PRIORITY_MASK = 0xE000L;
    private static final int PRIORITY_SHIFT = 13;
    private static final long LABEL_MASK = 0xE000000L;
    private static final int LABEL_SHIFT = 25;

    public MessageFlagsConverter() {
        super(FLAG_NAMES, "", 16);
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }

        long bits = parse(value);
        int priority = (int) ((bits & PRIORITY_MASK) >> PRIORITY_SHIFT);
        if (priority >= PRIORITY_LABELS.size()) {
            throw new IllegalArgumentException("invalid priority " + priority + " in " + value);
        }
        long label = (bits & LABEL_MASK) >> LABEL_SHIFT;

        List<String> flags = decodeFlags(bits & ~PRIORITY_MASK & ~LABEL_MASK);
        if (priority != 0) {
            flags.add("Priorities:" + PRIORITY_LABELS.get(priority));
        }
        if (label != 0) {
            flags.add("Labels:0x" + Long.toHexString(label).toUpperCase());
        }
        return join(flags);
    }
}
