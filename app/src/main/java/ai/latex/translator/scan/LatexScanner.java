package ai.latex.translator.scan;

import java.util.Objects;
import java.util.Optional;

/**
 * Single pass tokenizer for LaTeX structure.
 *
 * <p>A backslash starts either a control word ({@code \\} followed by letters) or a control symbol
 * ({@code \\} followed by one other character). Control symbols are literal, except {@code \( \) \[ \]}
 * which are math delimiters. An unescaped {@code %} comments out the rest of the line.
 */
public class LatexScanner {

    public void scan(String content, ScanListener listener) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(listener, "listener");

        int length = content.length();
        int line = 1;
        int lineStart = 0;
        boolean inComment = false;
        int index = 0;
        while (index < length) {
            char current = content.charAt(index);
            if (current == '\n') {
                line++;
                lineStart = index + 1;
                inComment = false;
                index++;
                continue;
            }
            if (inComment) {
                index++;
                continue;
            }
            SourcePosition position = new SourcePosition(index, line, index - lineStart + 1);
            switch (current) {
                case '\\' -> {
                    index = scanControlSequence(content, index, position, listener);
                    continue;
                }
                case '%' -> inComment = true;
                case '{' -> listener.onOpen(Delimiter.BRACE, position);
                case '}' -> listener.onClose(Delimiter.BRACE, position);
                case '[' -> listener.onOpen(Delimiter.BRACKET, position);
                case ']' -> listener.onClose(Delimiter.BRACKET, position);
                case '$' -> {
                    if (index + 1 < length && content.charAt(index + 1) == '$') {
                        listener.onDisplayMathToggle(position);
                        index += 2;
                        continue;
                    }
                    listener.onInlineMathToggle(position);
                }
                default -> {
                    // plain text
                }
            }
            index++;
        }
        listener.onEnd(new SourcePosition(length, line, length - lineStart + 1));
    }

    private int scanControlSequence(String content, int start, SourcePosition position, ScanListener listener) {
        int length = content.length();
        if (start + 1 >= length) {
            return length;
        }
        char next = content.charAt(start + 1);
        if (!isLetter(next)) {
            switch (next) {
                case '(' -> listener.onOpen(Delimiter.PAREN_MATH, position);
                case ')' -> listener.onClose(Delimiter.PAREN_MATH, position);
                case '[' -> listener.onOpen(Delimiter.BRACKET_MATH, position);
                case ']' -> listener.onClose(Delimiter.BRACKET_MATH, position);
                case '\n' -> {
                    // a backslash before a newline is a control space; leave the newline to the main loop
                    return start + 1;
                }
                default -> {
                    // escaped character or control symbol
                }
            }
            return start + 2;
        }
        int end = start + 1;
        while (end < length && isLetter(content.charAt(end))) {
            end++;
        }
        String name = content.substring(start + 1, end);
        listener.onCommand(name, position, end);
        if ("begin".equals(name) || "end".equals(name)) {
            readGroupArgument(content, end).ifPresent(argument -> {
                if ("begin".equals(name)) {
                    listener.onBeginEnvironment(argument.value(), position);
                } else {
                    listener.onEndEnvironment(argument.value(), position, argument.end());
                }
            });
        }
        return end;
    }

    /**
     * Reads a single-line {@code {argument}} that starts at or after {@code from}, skipping spaces.
     */
    public static Optional<GroupArgument> readGroupArgument(String content, int from) {
        int index = from;
        int length = content.length();
        while (index < length && (content.charAt(index) == ' ' || content.charAt(index) == '\t')) {
            index++;
        }
        if (index >= length || content.charAt(index) != '{') {
            return Optional.empty();
        }
        int close = index + 1;
        while (close < length) {
            char c = content.charAt(close);
            if (c == '}') {
                break;
            }
            if (c == '{' || c == '\n' || c == '\\' || c == '%') {
                return Optional.empty();
            }
            close++;
        }
        if (close >= length) {
            return Optional.empty();
        }
        String value = content.substring(index + 1, close).trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GroupArgument(value, close + 1));
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * A plain group argument and the offset just past its closing brace.
     */
    public record GroupArgument(String value, int end) {
    }
}
