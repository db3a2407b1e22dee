package ai.latex.translator.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line level helpers shared by the validators and fixers.
 */
public final class LatexLines {

    public static final String END_DOCUMENT = "\\end{document}";

    private static final Pattern ENVIRONMENT_MARKER = Pattern.compile("\\\\(?:begin|end)\\s*\\{[^{}\\n]+}");
    private static final Pattern LEADING_COMMAND = Pattern.compile("^\\\\([A-Za-z]+)\\*?(?:\\s*\\{([^{}]*)})?");

    private LatexLines() {
    }

    public static List<String> split(String content) {
        return new ArrayList<>(Arrays.asList(content.split("\n", -1)));
    }

    public static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    /**
     * Index of the first unescaped {@code %}, or -1 when the line carries no comment.
     */
    public static int commentIndex(String line) {
        int index = 0;
        while (index < line.length()) {
            char c = line.charAt(index);
            if (c == '\\') {
                index += 2;
                continue;
            }
            if (c == '%') {
                return index;
            }
            index++;
        }
        return -1;
    }

    public static String code(String line) {
        int comment = commentIndex(line);
        return comment < 0 ? line : line.substring(0, comment);
    }

    public static boolean isCommentLine(String line) {
        return line.stripLeading().startsWith("%");
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    public static String leadingWhitespace(String line) {
        int index = 0;
        while (index < line.length() && Character.isWhitespace(line.charAt(index))) {
            index++;
        }
        return line.substring(0, index);
    }

    /**
     * Net count of unescaped braces in the uncommented part of the line, opening minus closing.
     */
    public static int braceBalance(String line) {
        String code = code(line);
        int balance = 0;
        int index = 0;
        while (index < code.length()) {
            char c = code.charAt(index);
            if (c == '\\') {
                index += 2;
                continue;
            }
            if (c == '{') {
                balance++;
            } else if (c == '}') {
                balance--;
            }
            index++;
        }
        return balance;
    }

    /**
     * Environment markers such as {@code \begin{figure}} found in the uncommented part of the line.
     */
    public static List<String> activeEnvironmentMarkers(String line) {
        return markers(code(line));
    }

    /**
     * Environment markers that only occur inside the comment of the line.
     */
    public static List<String> commentedEnvironmentMarkers(String line) {
        int comment = commentIndex(line);
        if (comment < 0) {
            return List.of();
        }
        return markers(line.substring(comment));
    }

    public static int countActive(List<String> lines, String marker) {
        int count = 0;
        for (String line : lines) {
            count += occurrences(code(line), marker);
        }
        return count;
    }

    public static int occurrences(String text, String marker) {
        int count = 0;
        int from = text.indexOf(marker);
        while (from >= 0) {
            count++;
            from = text.indexOf(marker, from + marker.length());
        }
        return count;
    }

    /**
     * Uncomments a marker that sits in the comment of the line. Only succeeds when nothing but
     * comment signs and whitespace separates the comment start from the marker, so no commented
     * prose is ever exposed.
     */
    public static Optional<String> uncommentMarker(String line, String marker) {
        int comment = commentIndex(line);
        if (comment < 0) {
            return Optional.empty();
        }
        int markerIndex = line.indexOf(marker, comment);
        if (markerIndex < 0) {
            return Optional.empty();
        }
        for (int i = comment; i < markerIndex; i++) {
            char c = line.charAt(i);
            if (c != '%' && !Character.isWhitespace(c)) {
                return Optional.empty();
            }
        }
        return Optional.of(line.substring(0, comment) + line.substring(markerIndex));
    }

    /**
     * Coarse structural kind of a line, ignoring comment signs: blank, text, or the leading command.
     */
    public static String kind(String line) {
        String stripped = line.strip();
        while (stripped.startsWith("%")) {
            stripped = stripped.substring(1).strip();
        }
        if (stripped.isEmpty()) {
            return "blank";
        }
        Matcher matcher = LEADING_COMMAND.matcher(stripped);
        if (!matcher.find()) {
            return "text";
        }
        String name = matcher.group(1);
        if (("begin".equals(name) || "end".equals(name)) && matcher.group(2) != null) {
            return name + ":" + matcher.group(2).trim();
        }
        return "command:" + name;
    }

    private static List<String> markers(String text) {
        List<String> result = new ArrayList<>();
        Matcher matcher = ENVIRONMENT_MARKER.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group().replaceAll("\\s+\\{", "{"));
        }
        return result;
    }
}
