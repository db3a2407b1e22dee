package ai.latex.translator.scan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LatexScannerTest {

    private final LatexScanner scanner = new LatexScanner();

    @Test
    void reportsBracesWithLineAndColumn() {
        RecordingListener listener = scan("a{b\n  }");

        assertThat(listener.events).containsExactly("open BRACE 1:2", "close BRACE 2:3", "end");
    }

    @Test
    void ignoresCommentsAndEscapedDelimiters() {
        RecordingListener listener = scan("\\{ \\} \\% 50\\% % { [ $\nx");

        assertThat(listener.events).containsExactly("end");
    }

    @Test
    void doubleBackslashDoesNotEscapeFollowingBrace() {
        RecordingListener listener = scan("\\\\{");

        assertThat(listener.events).containsExactly("open BRACE 1:3", "end");
    }

    @Test
    void reportsMathDelimiters() {
        RecordingListener listener = scan("$x$ $$y$$ \\(z\\) \\[w\\]");

        assertThat(listener.events).containsExactly(
                "inline 1:1", "inline 1:3",
                "display 1:5", "display 1:8",
                "open PAREN_MATH 1:11", "close PAREN_MATH 1:14",
                "open BRACKET_MATH 1:17", "close BRACKET_MATH 1:20",
                "end");
    }

    @Test
    void reportsEnvironmentMarkersAndTheirArgumentBraces() {
        RecordingListener listener = scan("\\begin{figure}\n\\end{figure}");

        assertThat(listener.environments).containsExactly("begin figure 1", "end figure 2");
        assertThat(listener.events).filteredOn(event -> event.startsWith("open BRACE")).hasSize(2);
        assertThat(listener.events).filteredOn(event -> event.startsWith("close BRACE")).hasSize(2);
    }

    @Test
    void readGroupArgumentSkipsSpacesAndRejectsNestedGroups() {
        assertThat(LatexScanner.readGroupArgument("  {table*} rest", 0))
                .hasValueSatisfying(argument -> {
                    assertThat(argument.value()).isEqualTo("table*");
                    assertThat(argument.end()).isEqualTo(10);
                });
        assertThat(LatexScanner.readGroupArgument("{a{b}}", 0)).isEmpty();
        assertThat(LatexScanner.readGroupArgument("{}", 0)).isEmpty();
        assertThat(LatexScanner.readGroupArgument("x{a}", 0)).isEmpty();
    }

    private RecordingListener scan(String content) {
        RecordingListener listener = new RecordingListener();
        scanner.scan(content, listener);
        return listener;
    }

    private static final class RecordingListener implements ScanListener {

        private final List<String> events = new ArrayList<>();
        private final List<String> environments = new ArrayList<>();

        @Override
        public void onOpen(Delimiter delimiter, SourcePosition position) {
            events.add("open " + delimiter + " " + position.line() + ":" + position.column());
        }

        @Override
        public void onClose(Delimiter delimiter, SourcePosition position) {
            events.add("close " + delimiter + " " + position.line() + ":" + position.column());
        }

        @Override
        public void onInlineMathToggle(SourcePosition position) {
            events.add("inline " + position.line() + ":" + position.column());
        }

        @Override
        public void onDisplayMathToggle(SourcePosition position) {
            events.add("display " + position.line() + ":" + position.column());
        }

        @Override
        public void onBeginEnvironment(String name, SourcePosition position) {
            environments.add("begin " + name + " " + position.line());
        }

        @Override
        public void onEndEnvironment(String name, SourcePosition position, int tokenEnd) {
            environments.add("end " + name + " " + position.line());
        }

        @Override
        public void onEnd(SourcePosition position) {
            events.add("end");
        }
    }
}
