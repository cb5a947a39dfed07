package org.exposql.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * JSON-lines logger for compile and execute diagnostics. Keys of nested objects are sorted so that
 * two runs over the same input produce identical lines apart from the timestamp.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(outputStream, Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
        CorrelationContext correlation = Objects.requireNonNull(correlationContext, "correlationContext");

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", normalizeLevel(level));
        event.put("message", message == null ? "" : message);
        event.putAll(correlation.asFields());
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                String key = entry.getKey();
                // reserved keys win over caller fields
                if (key == null || key.isBlank() || event.containsKey(key)) {
                    continue;
                }
                event.put(key, entry.getValue());
            }
        }

        writeLine(JsonEncoder.encode(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }

    static final class JsonEncoder {
        private JsonEncoder() {
        }

        static String encode(Map<String, Object> event) {
            StringBuilder sb = new StringBuilder();
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : event.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendString(sb, entry.getKey());
                sb.append(':');
                appendValue(sb, entry.getValue());
            }
            return sb.append('}').toString();
        }

        private static void appendValue(StringBuilder sb, Object value) {
            if (value instanceof Optional<?> optional) {
                appendValue(sb, optional.orElse(null));
                return;
            }
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number number) {
                appendNumber(sb, number);
            } else if (value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Enum<?> constant) {
                appendString(sb, constant.name());
            } else if (value instanceof Map<?, ?> map) {
                appendObject(sb, map);
            } else if (value instanceof Collection<?> collection) {
                appendArray(sb, collection);
            } else {
                appendString(sb, String.valueOf(value));
            }
        }

        private static void appendNumber(StringBuilder sb, Number number) {
            if (number instanceof Double || number instanceof Float) {
                double d = number.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    appendString(sb, String.valueOf(d));
                    return;
                }
            }
            sb.append(number);
        }

        private static void appendObject(StringBuilder sb, Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendString(sb, entry.getKey());
                sb.append(':');
                appendValue(sb, entry.getValue());
            }
            sb.append('}');
        }

        private static void appendArray(StringBuilder sb, Collection<?> items) {
            sb.append('[');
            boolean first = true;
            for (Object item : items) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendValue(sb, item);
            }
            sb.append(']');
        }

        private static void appendString(StringBuilder sb, String value) {
            sb.append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> {
                        if (c <= 0x1F) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            sb.append('"');
        }
    }
}
