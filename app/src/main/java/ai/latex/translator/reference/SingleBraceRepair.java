package ai.latex.translator.reference;

import ai.latex.translator.scan.LatexLines;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Restores a single missing or extra {@code }} on a translated line, guided by the original line.
 *
 * <p>Both lines are reduced to their runs of consecutive closing braces, each followed by an
 * anchor: the text up to the next brace. The repair applies only when every run matches except one,
 * and that run differs by exactly one brace while its anchor keeps the original's markup.
 */
final class SingleBraceRepair {

    private static final Pattern RECOGNISED_COMMAND = Pattern.compile(
            "\\\\(?:multicolumn|multirow|textbf|textit|textsc|texttt|emph|underline|textcolor|colorbox|"
                    + "caption|section|subsection|subsubsection|paragraph|resizebox|scalebox|footnote|mathbf)(?![A-Za-z])"
                    + "|\\\\end\\{tabular\\*?}");
    private static final Pattern ANCHOR_MARKUP = Pattern.compile("\\\\[A-Za-z]+|\\\\\\\\|[&$=^_\\[\\]()]");

    private SingleBraceRepair() {
    }

    static Optional<String> repair(String translated, String original) {
        String originalCode = LatexLines.code(original);
        if (!RECOGNISED_COMMAND.matcher(originalCode).find()) {
            return Optional.empty();
        }
        int difference = LatexLines.braceBalance(translated) - LatexLines.braceBalance(original);
        if (Math.abs(difference) != 1) {
            return Optional.empty();
        }
        String translatedCode = LatexLines.code(translated);
        String comment = translated.substring(translatedCode.length());
        List<Run> originalRuns = runs(originalCode);
        List<Run> translatedRuns = runs(translatedCode);

        if (originalRuns.size() == translatedRuns.size()) {
            return repairAlignedRuns(translatedCode, comment, originalRuns, translatedRuns, difference);
        }
        if (difference == 1 && translatedRuns.size() == originalRuns.size() - 1) {
            return restoreFinalRun(translatedCode, comment, originalRuns, translatedRuns);
        }
        return Optional.empty();
    }

    private static Optional<String> repairAlignedRuns(String code, String comment, List<Run> originalRuns,
                                                      List<Run> translatedRuns, int difference) {
        int candidate = -1;
        for (int i = 0; i < originalRuns.size(); i++) {
            Run expected = originalRuns.get(i);
            Run actual = translatedRuns.get(i);
            if (expected.count() == actual.count()) {
                continue;
            }
            if (candidate >= 0 || actual.count() + difference != expected.count()
                    || !markup(expected.anchor()).equals(markup(actual.anchor()))) {
                return Optional.empty();
            }
            candidate = i;
        }
        if (candidate < 0) {
            return Optional.empty();
        }
        Run run = translatedRuns.get(candidate);
        String repaired = difference > 0
                ? code.substring(0, run.end()) + "}" + code.substring(run.end())
                : code.substring(0, run.end() - 1) + code.substring(run.end());
        return Optional.of(repaired + comment);
    }

    /**
     * The translation lost the last closing group entirely, e.g. {@code \textbf{bold} x} became
     * {@code \textbf{fett x}}: close it right before the original's trailing markup.
     */
    private static Optional<String> restoreFinalRun(String code, String comment, List<Run> originalRuns,
                                                    List<Run> translatedRuns) {
        Run last = originalRuns.get(originalRuns.size() - 1);
        if (last.count() != 1) {
            return Optional.empty();
        }
        for (int i = 0; i < translatedRuns.size(); i++) {
            if (translatedRuns.get(i).count() != originalRuns.get(i).count()) {
                return Optional.empty();
            }
        }
        String trailing = last.anchor();
        String trimmedCode = stripTrailing(code);
        String trimmedTrailing = trailing.strip();
        int insertAt;
        if (trimmedTrailing.isEmpty()) {
            insertAt = trimmedCode.length();
        } else if (trimmedCode.endsWith(trimmedTrailing)) {
            insertAt = stripTrailing(trimmedCode.substring(0, trimmedCode.length() - trimmedTrailing.length())).length();
        } else {
            return Optional.empty();
        }
        return Optional.of(code.substring(0, insertAt) + "}" + code.substring(insertAt) + comment);
    }

    private static String stripTrailing(String value) {
        return value.stripTrailing();
    }

    private static String markup(String anchor) {
        StringBuilder builder = new StringBuilder();
        Matcher matcher = ANCHOR_MARKUP.matcher(anchor);
        while (matcher.find()) {
            builder.append(matcher.group());
        }
        return builder.toString();
    }

    static List<Run> runs(String code) {
        List<Run> runs = new ArrayList<>();
        int index = 0;
        int length = code.length();
        while (index < length) {
            char c = code.charAt(index);
            if (c == '\\') {
                index += 2;
                continue;
            }
            if (c != '}') {
                index++;
                continue;
            }
            int start = index;
            while (index < length && code.charAt(index) == '}') {
                index++;
            }
            int anchorEnd = index;
            while (anchorEnd < length && code.charAt(anchorEnd) != '{' && code.charAt(anchorEnd) != '}') {
                if (code.charAt(anchorEnd) == '\\') {
                    anchorEnd++;
                }
                anchorEnd++;
            }
            anchorEnd = Math.min(anchorEnd, length);
            runs.add(new Run(start, index, code.substring(index, anchorEnd)));
        }
        return runs;
    }

    /**
     * @param end offset just past the last brace of the run
     */
    record Run(int start, int end, String anchor) {

        int count() {
            return end - start;
        }
    }
}
