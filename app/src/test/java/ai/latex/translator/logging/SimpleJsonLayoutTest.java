package ai.latex.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "Repair of \"paper.tex\" finished");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"Repair of \\\"paper.tex\\\" finished\"");
        assertThat(json).contains("\"logger\":\"ai.latex.translator.cli\"");
        assertThat(json).contains("\"level\":\"WARN\"");
        assertThat(json).doesNotContain("\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesExceptionStackTrace() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: boom\\n");
    }

    @Test
    void promotesRepairContextAndNestsOtherMdcEntries() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "Applied fix");
        Map<String, String> mdc = new LinkedHashMap<>();
        mdc.put("requestId", "42");
        mdc.put(LogContext.STAGE, "reference-fix");
        mdc.put(LogContext.DOCUMENT, "paper.tex");
        event.setMDCPropertyMap(mdc);

        String json = layout.doLayout(event);

        assertThat(json).contains("\"document\":\"paper.tex\",\"stage\":\"reference-fix\",\"message\":\"Applied fix\"");
        assertThat(json).contains("\"mdc\":{\"requestId\":\"42\"}");
        assertThat(json).doesNotContain("\"command\"");
    }

    @Test
    void escapesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("a\\b\tc\u0001")).isEqualTo("\"a\\\\b\\tc\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);
        event.setLoggerName("ai.latex.translator.cli");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
