package org.morkdb.filters;

import java.util.Arrays;
import java.util.List;

/**
 * IMAP message flags (nsImapCore.h), with a label packed in bits 9-11.
 */
public final class ImapFlagsConverter extends FlagsConverter {

    private static final List<String> FLAG_NAMES = Arrays.asList(
            "kImapMsgSeenFlag", "kImapMsgAnsweredFlag",
            "kImapMsgFlaggedFlag", "kImapMsgDeletedFlag",
            "kImapMsgDraftFlag", "kImapMsgRecentFlag",
            "kImapMsgForwardedFlag", "kImapMsgMDNSentFlag",
            "kImapMsgCustomKeywordFlag", null, null, null, null,
            "kImapMsgSupportMDNSentFlag", "kImapMsgSupportForwardedFlag",
            "kImapMsgSupportUserFlag");

    private static final long LABEL_MASK = 0xE00L;
    private static final int LABEL_SHIFT = 9;

    public ImapFlagsConverter() {
        super(FLAG_NAMES, "kNoImapMsgFlag", 16);
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }

        long bits = parse(value);
        long label = (bits & LABEL_MASK) >> LABEL_SHIFT;

        List<String> flags = decodeFlags(bits & ~LABEL_MASK);
        if (label != 0) {
            flags.add("Labels:0x" + Long.toHexString(label).toUpperCase());
        }
        return join(flags);
    }
}
