package org.morkdb.builder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects warnings about constructs that are recognized but not applied
 * (cut, truncated and meta markers, skipped items). Each warning is logged
 * and kept for the caller.
 */
final class BuildDiagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(BuildDiagnostics.class);

    private final List<String> warnings = new ArrayList<>();

    void warn(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        LOGGER.warn(message);
        warnings.add(message);
    }

    List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
