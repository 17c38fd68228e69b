package org.morkdb.filters;

import org.morkdb.model.MorkDatabase;
import org.morkdb.model.MorkRow;
import org.morkdb.model.ObjectStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites known fields of a built database into human-readable form.
 *
 * This is the one mutation applied to a database after it is built. Values
 * are replaced in place, so every table sharing a row sees the converted
 * value. Must not run while other threads read the database.
 */
public final class FieldConversionFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FieldConversionFilter.class);

    private final FieldConverterRegistry registry;

    public FieldConversionFilter() {
        this(FieldConverterRegistry.defaults());
    }

    public FieldConversionFilter(FieldConverterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    /**
     * Converts every known field of every row.
     *
     * @return Number of values rewritten
     * @throws FieldConversionException if a known field holds an unreadable value
     */
    public int process(MorkDatabase database, ConversionOptions options) {
        if (options.noConvert()) {
            return 0;
        }

        int converted = 0;
        for (ObjectStore.Entry<MorkRow> entry : database.rows()) {
            Map<String, FieldConverter> rowConverters = registry.convertersFor(entry.namespace());
            if (rowConverters.isEmpty()) {
                continue;
            }

            MorkRow row = entry.value();
            for (String column : new ArrayList<>(row.columnNames())) {
                FieldConverter converter = rowConverters.get(column);
                if (converter == null) {
                    continue;
                }
                String value = row.get(column).orElseThrow();
                try {
                    row.setValue(column, converter.convert(options, value));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw new FieldConversionException(entry.namespace(), column, value, e);
                }
                converted++;
            }
        }

        LOGGER.debug("converted {} field values", converted);
        return converted;
    }
}
