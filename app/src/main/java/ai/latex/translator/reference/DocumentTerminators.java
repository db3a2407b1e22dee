package ai.latex.translator.reference;

import ai.latex.translator.scan.LatexLines;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rules around {@code \end{document}} shared by the rule-based and the reference-based fixers.
 */
public final class DocumentTerminators {

    private static final String MARKER = LatexLines.END_DOCUMENT;

    private DocumentTerminators() {
    }

    public static int count(List<String> lines) {
        return LatexLines.countActive(lines, MARKER);
    }

    /**
     * Index of the first line whose uncommented part holds {@code \end{document}}, or -1.
     */
    public static int firstLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (LatexLines.code(lines.get(i)).contains(MARKER)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Keeps the first terminator and drops every later one together with the lines that follow the
     * first terminator, except lines found in {@code keptTail}. Lines up to the first terminator are
     * untouched.
     */
    public static Optional<Collapse> collapseDuplicates(List<String> lines, Set<String> keptTail) {
        if (count(lines) <= 1) {
            return Optional.empty();
        }
        int first = firstLine(lines);
        List<String> result = new ArrayList<>(lines.subList(0, first));
        String terminatorLine = lines.get(first);
        String code = LatexLines.code(terminatorLine);
        int markerEnd = code.indexOf(MARKER) + MARKER.length();
        int removed = LatexLines.occurrences(code.substring(markerEnd), MARKER);
        String rest = code.substring(markerEnd).replace(MARKER, "");
        result.add(code.substring(0, markerEnd) + (rest.isBlank() ? "" : rest)
                + terminatorLine.substring(code.length()));

        int dropped = 0;
        for (String line : lines.subList(first + 1, lines.size())) {
            boolean terminator = LatexLines.code(line).contains(MARKER);
            if (terminator) {
                removed += LatexLines.occurrences(LatexLines.code(line), MARKER);
            }
            if (!terminator && keptTail.contains(line)) {
                result.add(line);
            } else {
                dropped++;
            }
        }
        return Optional.of(new Collapse(result, removed, dropped));
    }

    /**
     * Truncates everything after the first terminator on its line and below.
     */
    public static Optional<List<String>> truncateAfterFirst(List<String> lines) {
        int first = firstLine(lines);
        if (first < 0) {
            return Optional.empty();
        }
        String line = lines.get(first);
        int markerEnd = LatexLines.code(line).indexOf(MARKER) + MARKER.length();
        List<String> result = new ArrayList<>(lines.subList(0, first));
        result.add(line.substring(0, markerEnd));
        if (result.equals(lines)) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    /**
     * Removes a run of closing braces trailing the terminator on the same line.
     */
    public static Optional<String> stripTrailingBraces(String line) {
        String code = LatexLines.code(line);
        int markerIndex = code.indexOf(MARKER);
        if (markerIndex < 0) {
            return Optional.empty();
        }
        String after = code.substring(markerIndex + MARKER.length());
        if (after.isBlank() || !after.strip().chars().allMatch(c -> c == '}' || Character.isWhitespace(c))) {
            return Optional.empty();
        }
        return Optional.of(code.substring(0, markerIndex + MARKER.length()) + line.substring(code.length()));
    }

    /**
     * @param removedTerminators later {@code \end{document}} occurrences removed
     * @param droppedLines lines removed after the first terminator, terminators included
     */
    public record Collapse(List<String> lines, int removedTerminators, int droppedLines) {

        public Collapse {
            lines = List.copyOf(lines);
        }
    }
}
