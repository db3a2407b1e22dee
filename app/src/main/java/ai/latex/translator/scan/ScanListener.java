package ai.latex.translator.scan;

/**
 * Receives the structural tokens found by {@link LatexScanner}. Commented text never produces events.
 */
public interface ScanListener {

    default void onOpen(Delimiter delimiter, SourcePosition position) {
    }

    default void onClose(Delimiter delimiter, SourcePosition position) {
    }

    default void onInlineMathToggle(SourcePosition position) {
    }

    default void onDisplayMathToggle(SourcePosition position) {
    }

    /**
     * @param name command name without the leading backslash
     * @param nameEnd offset just past the last letter of the name
     */
    default void onCommand(String name, SourcePosition position, int nameEnd) {
    }

    default void onBeginEnvironment(String name, SourcePosition position) {
    }

    /**
     * @param tokenEnd offset just past the closing brace of {@code \end{name}}
     */
    default void onEndEnvironment(String name, SourcePosition position, int tokenEnd) {
    }

    default void onEnd(SourcePosition position) {
    }
}
