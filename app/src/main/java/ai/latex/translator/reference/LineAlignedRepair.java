package ai.latex.translator.reference;

import ai.latex.translator.scan.LatexLines;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Line-aligned repair: compares each translated line with the original line at the same index.
 *
 * <p>Every rule only fires when its precondition holds and leaves a line on which that precondition
 * is false, so running the repair twice changes nothing the second time.
 */
final class LineAlignedRepair implements RepairStrategy {

    @Override
    public RepairOutcome repair(List<String> translated, List<String> original) {
        if (translated.size() != original.size()) {
            throw new IllegalArgumentException("line-aligned repair needs equal line counts");
        }
        return repairRange(translated, original, translated.size(), 0);
    }

    /**
     * Repairs the first {@code prefix} line pairs counted from the top and the last {@code suffix}
     * pairs counted from the bottom of each document.
     */
    RepairOutcome repairRange(List<String> translated, List<String> original, int prefix, int suffix) {
        List<String> lines = new ArrayList<>(translated);
        List<String> details = new ArrayList<>();
        for (int i = 0; i < prefix; i++) {
            lines.set(i, repairLine(lines.get(i), original.get(i), i + 1, details));
        }
        for (int k = 1; k <= suffix; k++) {
            int t = lines.size() - k;
            int o = original.size() - k;
            lines.set(t, repairLine(lines.get(t), original.get(o), t + 1, details));
        }
        return new RepairOutcome(lines, details);
    }

    String repairLine(String translated, String original, int lineNumber, List<String> details) {
        if (translated.equals(original) || original.isBlank()) {
            return translated;
        }
        String current = translated;

        for (String marker : LatexLines.activeEnvironmentMarkers(original)) {
            if (LatexLines.activeEnvironmentMarkers(current).contains(marker)
                    || !LatexLines.commentedEnvironmentMarkers(current).contains(marker)) {
                continue;
            }
            Optional<String> uncommented = LatexLines.uncommentMarker(current, marker);
            if (uncommented.isPresent()) {
                current = uncommented.get();
                details.add("L" + lineNumber + ": uncommented " + marker);
            }
        }

        if (LatexLines.isCommentLine(original) && !LatexLines.isCommentLine(current) && !current.isBlank()) {
            current = commentPrefix(original) + current.strip();
            details.add("L" + lineNumber + ": restored comment marker");
        }

        if (LatexLines.code(current).contains(LatexLines.END_DOCUMENT)
                && !LatexLines.code(original).contains(LatexLines.END_DOCUMENT)) {
            String code = LatexLines.code(current);
            String remaining = code.replace(LatexLines.END_DOCUMENT, "");
            current = (remaining.isBlank() ? "" : remaining.stripTrailing()) + current.substring(code.length());
            details.add("L" + lineNumber + ": removed stray \\end{document}");
        }

        if (DocumentTerminators.stripTrailingBraces(original).isEmpty()) {
            Optional<String> stripped = DocumentTerminators.stripTrailingBraces(current);
            if (stripped.isPresent() && LatexLines.code(original).contains(LatexLines.END_DOCUMENT)) {
                current = stripped.get();
                details.add("L" + lineNumber + ": removed closing braces after \\end{document}");
            }
        }

        Optional<String> braced = SingleBraceRepair.repair(current, original);
        if (braced.isPresent()) {
            boolean added = LatexLines.braceBalance(braced.get()) < LatexLines.braceBalance(current);
            current = braced.get();
            details.add("L" + lineNumber + (added ? ": added missing closing brace" : ": removed extra closing brace"));
        }
        return current;
    }

    private static String commentPrefix(String commentLine) {
        String indent = LatexLines.leadingWhitespace(commentLine);
        int index = indent.length();
        while (index < commentLine.length() && commentLine.charAt(index) == '%') {
            index++;
        }
        String prefix = commentLine.substring(0, index);
        return prefix + " ";
    }
}
