package ai.latex.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes one JSON object per event. The command, document and repair stage from {@link LogContext}
 * appear as top-level fields; any other MDC entries are nested under {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    @Override
    public String doLayout(ILoggingEvent event) {
        StringJoiner fields = new StringJoiner(",", "{", "}");
        fields.add(field("timestamp", DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(event.getTimeStamp()))));
        fields.add(field("level", String.valueOf(event.getLevel())));
        fields.add(field("logger", event.getLoggerName()));
        fields.add(field("thread", event.getThreadName()));

        Map<String, String> extra = new LinkedHashMap<>();
        if (event.getMDCPropertyMap() != null) {
            extra.putAll(event.getMDCPropertyMap());
        }
        for (String key : LogContext.PROMOTED_KEYS) {
            String value = extra.remove(key);
            if (value != null) {
                fields.add(field(key, value));
            }
        }
        fields.add(field("message", event.getFormattedMessage()));

        if (!extra.isEmpty()) {
            StringJoiner nested = new StringJoiner(",", "{", "}");
            extra.forEach((key, value) -> nested.add(field(key, value)));
            fields.add(quote("mdc") + ':' + nested);
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            fields.add(field("exception", ThrowableProxyUtil.asString(throwable)));
        }
        return fields + System.lineSeparator();
    }

    private static String field(String name, String value) {
        return quote(name) + ':' + quote(value);
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        value.chars().forEach(ch -> {
            if (ch == '"' || ch == '\\') {
                out.append('\\').append((char) ch);
            } else if (ch == '\n') {
                out.append("\\n");
            } else if (ch == '\r') {
                out.append("\\r");
            } else if (ch == '\t') {
                out.append("\\t");
            } else if (ch < 0x20) {
                out.append(String.format("\\u%04x", ch));
            } else {
                out.append((char) ch);
            }
        });
        return out.append('"').toString();
    }
}
