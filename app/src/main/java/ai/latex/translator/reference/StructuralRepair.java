package ai.latex.translator.reference;

import ai.latex.translator.scan.LatexLines;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural repair for translations whose line count drifted from the original: compares marker
 * counts instead of aligned lines, then hands the parts of the document that still line up over to
 * {@link LineAlignedRepair}.
 */
final class StructuralRepair implements RepairStrategy {

    private final LineAlignedRepair lineAligned;

    StructuralRepair(LineAlignedRepair lineAligned) {
        this.lineAligned = lineAligned;
    }

    @Override
    public RepairOutcome repair(List<String> translated, List<String> original) {
        List<String> details = new ArrayList<>();
        List<String> lines = new ArrayList<>(translated);

        lines = collapseTerminators(lines, original, details);
        uncommentEnvironmentBlocks(lines, original, details);
        stripBracesAfterTerminator(lines, original, details);
        lines = insertMissingEnds(lines, original, details);

        RepairOutcome structural = new RepairOutcome(lines, details);
        if (lines.size() == original.size()) {
            return structural.then(lineAligned.repair(lines, original));
        }
        int prefix = commonPrefix(lines, original);
        int suffix = commonSuffix(lines, original, prefix);
        return structural.then(lineAligned.repairRange(lines, original, prefix, suffix));
    }

    private List<String> collapseTerminators(List<String> lines, List<String> original, List<String> details) {
        if (DocumentTerminators.count(original) != 1) {
            return lines;
        }
        int originalTerminator = DocumentTerminators.firstLine(original);
        Set<String> originalTail = new HashSet<>(original.subList(originalTerminator + 1, original.size()));
        Optional<DocumentTerminators.Collapse> collapse = DocumentTerminators.collapseDuplicates(lines, originalTail);
        if (collapse.isEmpty()) {
            return lines;
        }
        int first = DocumentTerminators.firstLine(lines);
        details.add("L" + (first + 1) + ": kept first \\end{document}, removed "
                + collapse.get().removedTerminators() + " duplicate(s) and "
                + collapse.get().droppedLines() + " trailing line(s)");
        return new ArrayList<>(collapse.get().lines());
    }

    private void uncommentEnvironmentBlocks(List<String> lines, List<String> original, List<String> details) {
        for (String environment : activeEnvironments(original)) {
            String begin = "\\begin{" + environment + "}";
            String end = "\\end{" + environment + "}";
            int missing = LatexLines.countActive(original, begin) - LatexLines.countActive(lines, begin);
            for (int from = 0; missing > 0 && from < lines.size(); from++) {
                if (!LatexLines.commentedEnvironmentMarkers(lines.get(from)).contains(begin)
                        || LatexLines.activeEnvironmentMarkers(lines.get(from)).contains(begin)) {
                    continue;
                }
                int endLine = findCommentedEnd(lines, from, begin, end);
                if (endLine < 0) {
                    continue;
                }
                Optional<String> openLine = LatexLines.uncommentMarker(lines.get(from), begin);
                Optional<String> closeLine = LatexLines.uncommentMarker(lines.get(endLine), end);
                if (openLine.isEmpty() || closeLine.isEmpty()) {
                    continue;
                }
                lines.set(from, openLine.get());
                lines.set(endLine, closeLine.get());
                details.add("L" + (from + 1) + "-L" + (endLine + 1) + ": uncommented " + environment + " environment");
                missing--;
                from = endLine;
            }
        }
    }

    private int findCommentedEnd(List<String> lines, int from, String begin, String end) {
        for (int i = from + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (LatexLines.activeEnvironmentMarkers(line).contains(begin)
                    || LatexLines.activeEnvironmentMarkers(line).contains(end)) {
                return -1;
            }
            if (LatexLines.commentedEnvironmentMarkers(line).contains(end)) {
                return i;
            }
        }
        return -1;
    }

    private void stripBracesAfterTerminator(List<String> lines, List<String> original, List<String> details) {
        int originalTerminator = DocumentTerminators.firstLine(original);
        int terminator = DocumentTerminators.firstLine(lines);
        if (originalTerminator < 0 || terminator < 0
                || DocumentTerminators.stripTrailingBraces(original.get(originalTerminator)).isPresent()) {
            return;
        }
        DocumentTerminators.stripTrailingBraces(lines.get(terminator)).ifPresent(stripped -> {
            lines.set(terminator, stripped);
            details.add("L" + (terminator + 1) + ": removed closing braces after \\end{document}");
        });
    }

    /**
     * Restores a single {@code \end{env}} the translation dropped. A commented-out {@code \end{env}}
     * after the unclosed {@code \begin{env}} is uncommented; otherwise the marker goes in front of the
     * first line that looks like the line following {@code \end{env}} in the original.
     */
    private List<String> insertMissingEnds(List<String> lines, List<String> original, List<String> details) {
        List<String> result = lines;
        for (String environment : activeEnvironments(original)) {
            String begin = "\\begin{" + environment + "}";
            String end = "\\end{" + environment + "}";
            if (LatexLines.countActive(result, begin) != LatexLines.countActive(original, begin)
                    || LatexLines.countActive(original, end) - LatexLines.countActive(result, end) != 1) {
                continue;
            }
            int unclosed = lastUnclosedBegin(result, begin, end);
            String follower = lineAfter(original, end);
            if (unclosed < 0 || follower == null) {
                continue;
            }
            String followerKind = LatexLines.kind(follower);
            for (int i = unclosed + 1; i < result.size(); i++) {
                Optional<String> uncommented = LatexLines.commentedEnvironmentMarkers(result.get(i)).contains(end)
                        ? LatexLines.uncommentMarker(result.get(i), end)
                        : Optional.empty();
                if (uncommented.isPresent()) {
                    result = new ArrayList<>(result);
                    result.set(i, uncommented.get());
                    details.add("L" + (i + 1) + ": uncommented " + end);
                    break;
                }
                if (LatexLines.kind(result.get(i)).equals(followerKind)) {
                    result = new ArrayList<>(result);
                    result.add(i, LatexLines.leadingWhitespace(result.get(unclosed)) + end);
                    details.add("L" + (i + 1) + ": inserted missing " + end);
                    break;
                }
            }
        }
        return result;
    }

    private int lastUnclosedBegin(List<String> lines, String begin, String end) {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < lines.size(); i++) {
            String code = LatexLines.code(lines.get(i));
            for (int n = LatexLines.occurrences(code, begin); n > 0; n--) {
                open.push(i);
            }
            for (int n = LatexLines.occurrences(code, end); n > 0 && !open.isEmpty(); n--) {
                open.pop();
            }
        }
        return open.size() == 1 ? open.peek() : -1;
    }

    private String lineAfter(List<String> lines, String marker) {
        for (int i = 0; i < lines.size(); i++) {
            if (LatexLines.code(lines.get(i)).contains(marker)) {
                for (int j = i + 1; j < lines.size(); j++) {
                    if (!lines.get(j).isBlank()) {
                        return lines.get(j);
                    }
                }
                return null;
            }
        }
        return null;
    }

    private static Set<String> activeEnvironments(List<String> original) {
        Set<String> environments = new LinkedHashSet<>();
        for (String line : original) {
            for (String marker : LatexLines.activeEnvironmentMarkers(line)) {
                if (marker.startsWith("\\begin{")) {
                    environments.add(marker.substring("\\begin{".length(), marker.length() - 1));
                }
            }
        }
        environments.remove("document");
        return environments;
    }

    private static int commonPrefix(List<String> lines, List<String> original) {
        int limit = Math.min(lines.size(), original.size());
        int prefix = 0;
        while (prefix < limit && LatexLines.kind(lines.get(prefix)).equals(LatexLines.kind(original.get(prefix)))) {
            prefix++;
        }
        return prefix;
    }

    private static int commonSuffix(List<String> lines, List<String> original, int prefix) {
        int limit = Math.min(lines.size(), original.size()) - prefix;
        int suffix = 0;
        while (suffix < limit && LatexLines.kind(lines.get(lines.size() - 1 - suffix))
                .equals(LatexLines.kind(original.get(original.size() - 1 - suffix)))) {
            suffix++;
        }
        return suffix;
    }
}
