package org.morkdb.filters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folder view sort columns (nsMsgDBView DecodeColumnSort).
 *
 * Entries are separated by CR; each is a sort-type character followed by a
 * sort-order digit, repeated. A byCustom entry takes the rest of its piece
 * as the custom column name.
 */
public final class SortColumnsConverter implements FieldConverter {

    static final Map<Long, String> SORT_TYPES = Map.ofEntries(
            Map.entry(0x11L, "byNone"),
            Map.entry(0x12L, "byDate"),
            Map.entry(0x13L, "bySubject"),
            Map.entry(0x14L, "byAuthor"),
            Map.entry(0x15L, "byId"),
            Map.entry(0x16L, "byThread"),
            Map.entry(0x17L, "byPriority"),
            Map.entry(0x18L, "byStatus"),
            Map.entry(0x19L, "bySize"),
            Map.entry(0x1AL, "byFlagged"),
            Map.entry(0x1BL, "byUnread"),
            Map.entry(0x1CL, "byRecipient"),
            Map.entry(0x1DL, "byLocation"),
            Map.entry(0x1EL, "byTags"),
            Map.entry(0x1FL, "byJunkStatus"),
            Map.entry(0x20L, "byAttachments"),
            Map.entry(0x21L, "byAccount"),
            Map.entry(0x22L, "byCustom"),
            Map.entry(0x23L, "byReceived"));

    private static final List<String> SORT_ORDERS = List.of("none", "ascending", "descending");

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noSymbolic()) {
            return value;
        }

        List<String> items = new ArrayList<>();
        for (String piece : value.split("\r", -1)) {
            int i = 0;
            while (i < piece.length()) {
                String type = SORT_TYPES.get((long) piece.charAt(i));
                if (type == null) {
                    throw new IllegalArgumentException("invalid sort type in '" + value + "'");
                }
                int order = i + 1 < piece.length() ? piece.charAt(i + 1) - '0' : -1;
                if (order < 0 || order >= SORT_ORDERS.size()) {
                    throw new IllegalArgumentException("invalid sort order in '" + value + "'");
                }
                i += 2;

                String item = "type:" + type + " order:" + SORT_ORDERS.get(order);
                if (type.equals("byCustom")) {
                    item += " custom:" + piece.substring(i);
                    i = piece.length();
                }
                items.add(item);
            }
        }
        return String.join(", ", items);
    }
}
