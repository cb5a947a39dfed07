package org.exposql.obs;

import java.util.Map;

final class NoopJsonLinesLogger implements JsonLinesLogger {
    static final NoopJsonLinesLogger INSTANCE = new NoopJsonLinesLogger();

    private NoopJsonLinesLogger() {
    }

    @Override
    public void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields) {
    }

    @Override
    public void close() {
    }
}
