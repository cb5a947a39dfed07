package org.exposql.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields);

    default void info(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("INFO", message, correlationContext, fields);
    }

    default void info(String message, CorrelationContext correlationContext) {
        info(message, correlationContext, Collections.emptyMap());
    }

    default void error(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("ERROR", message, correlationContext, fields);
    }

    static JsonLinesLogger noop() {
        return NoopJsonLinesLogger.INSTANCE;
    }

    /**
     * Logger for command-line use: writes to standard error and never closes it.
     */
    static JsonLinesLogger stderr() {
        return new StructuredJsonLinesLogger(new NonClosingOutputStream(System.err));
    }

    @Override
    void close();
}
