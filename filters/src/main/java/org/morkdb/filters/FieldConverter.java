package org.morkdb.filters;

/**
 * Converts one raw field value into its display form.
 *
 * Implementations throw {@link IllegalArgumentException} (including
 * {@link NumberFormatException}) or {@link java.time.DateTimeException} for
 * values they cannot interpret or render.
 */
@FunctionalInterface
public interface FieldConverter {

    String convert(ConversionOptions options, String value);
}
