package org.morkdb.filters;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Switches for field conversion.
 *
 * @param noConvert  Skip all conversions
 * @param noTime     Leave times and dates as stored
 * @param noBase     Leave integers in their stored radix
 * @param noSymbolic Leave flags, booleans and enumerations numeric
 * @param timeFormat {@link DateTimeFormatter} pattern for times and dates
 * @param zone       Zone that epoch-based times are displayed in
 */
public record ConversionOptions(
        boolean noConvert,
        boolean noTime,
        boolean noBase,
        boolean noSymbolic,
        String timeFormat,
        ZoneId zone
) {

    /** Same layout as C's <code>%c</code> in the POSIX locale: "Thu Jan  1 00:00:00 1970". */
    public static final String DEFAULT_TIME_FORMAT = "EEE MMM ppd HH:mm:ss yyyy";

    public ConversionOptions {
        Objects.requireNonNull(timeFormat, "Time format cannot be null");
        Objects.requireNonNull(zone, "Zone cannot be null");
    }

    /**
     * All conversions on, default time format, system zone.
     */
    public static ConversionOptions defaults() {
        return new ConversionOptions(false, false, false, false, DEFAULT_TIME_FORMAT, ZoneId.systemDefault());
    }

    public ConversionOptions withZone(ZoneId newZone) {
        return new ConversionOptions(noConvert, noTime, noBase, noSymbolic, timeFormat, newZone);
    }

    public ConversionOptions withTimeFormat(String newTimeFormat) {
        return new ConversionOptions(noConvert, noTime, noBase, noSymbolic, newTimeFormat, zone);
    }

    public ConversionOptions withNoConvert(boolean flag) {
        return new ConversionOptions(flag, noTime, noBase, noSymbolic, timeFormat, zone);
    }

    public ConversionOptions withNoTime(boolean flag) {
        return new ConversionOptions(noConvert, flag, noBase, noSymbolic, timeFormat, zone);
    }

    public ConversionOptions withNoBase(boolean flag) {
        return new ConversionOptions(noConvert, noTime, flag, noSymbolic, timeFormat, zone);
    }

    public ConversionOptions withNoSymbolic(boolean flag) {
        return new ConversionOptions(noConvert, noTime, noBase, flag, timeFormat, zone);
    }

    public DateTimeFormatter formatter() {
        return DateTimeFormatter.ofPattern(timeFormat, Locale.US);
    }
}
