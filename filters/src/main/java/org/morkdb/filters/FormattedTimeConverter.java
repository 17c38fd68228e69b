package org.morkdb.filters;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Local time stored as text, re-rendered with the configured format.
 * Runs of whitespace in the stored text are collapsed before parsing. The
 * stored time is taken to be in the configured zone.
 */
public final class FormattedTimeConverter implements FieldConverter {

    /** Layout of ctime(3)-style stamps: "Sat Jan 30 12:01:02 2010". */
    public static final String CTIME_PATTERN = "EEE MMM d HH:mm:ss yyyy";

    private final DateTimeFormatter parser;

    public FormattedTimeConverter(String pattern) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        this.parser = DateTimeFormatter.ofPattern(pattern, Locale.US);
    }

    @Override
    public String convert(ConversionOptions options, String value) {
        if (options.noTime()) {
            return value;
        }

        try {
            LocalDateTime time = LocalDateTime.parse(value.trim().replaceAll("\\s+", " "), parser);
            return options.formatter().format(time.atZone(options.zone()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable time '" + value + "'", e);
        }
    }
}
