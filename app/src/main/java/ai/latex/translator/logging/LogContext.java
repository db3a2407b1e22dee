package ai.latex.translator.logging;

import org.slf4j.MDC;

/**
 * MDC keys shared by the commands and the repair pipeline. {@link SimpleJsonLayout} writes them as
 * top-level fields.
 */
public final class LogContext {

    public static final String COMMAND = "command";
    public static final String DOCUMENT = "document";
    public static final String STAGE = "stage";

    static final String[] PROMOTED_KEYS = {COMMAND, DOCUMENT, STAGE};

    private LogContext() {
    }

    public static MDC.MDCCloseable command(String command) {
        return MDC.putCloseable(COMMAND, command);
    }

    public static MDC.MDCCloseable document(Object document) {
        return MDC.putCloseable(DOCUMENT, String.valueOf(document));
    }

    public static MDC.MDCCloseable stage(String stage) {
        return MDC.putCloseable(STAGE, stage);
    }
}
