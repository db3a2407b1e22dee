package ai.latex.translator.reference;

import ai.latex.translator.scan.LatexLines;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs structural corruption in a translated document using the untranslated original as the
 * reference for its markup skeleton. Translated prose is never rewritten.
 *
 * <p>The repair never fails: on unexpected input it logs and returns the translation unchanged.
 * Applying it to its own output is a no-op.
 */
public class ReferenceBasedFixer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceBasedFixer.class);

    private static final int MAX_PASSES = 4;

    private final LineAlignedRepair lineAligned = new LineAlignedRepair();
    private final StructuralRepair structural = new StructuralRepair(lineAligned);

    private RepairStrategy strategyFor(RepairMode mode) {
        return switch (mode) {
            case LINE_ALIGNED -> lineAligned;
            case STRUCTURAL -> structural;
        };
    }

    public String applyReferenceBasedFixes(String translated, String original) {
        return repair(translated, original).content();
    }

    public LineFixResult repair(String translated, String original) {
        if (translated == null) {
            return LineFixResult.unchanged(RepairMode.LINE_ALIGNED, "");
        }
        if (original == null || original.isEmpty()) {
            return LineFixResult.unchanged(RepairMode.LINE_ALIGNED, translated);
        }
        List<String> originalLines = LatexLines.split(original);
        List<String> lines = LatexLines.split(translated);
        RepairMode mode = RepairMode.select(lines.size(), originalLines.size());
        try {
            List<String> details = new ArrayList<>();
            // a pass can enable rules that were blocked before it, e.g. an uncommented \begin
            for (int pass = 0; pass < MAX_PASSES; pass++) {
                RepairOutcome outcome = strategyFor(RepairMode.select(lines.size(), originalLines.size()))
                        .repair(lines, originalLines);
                if (outcome.details().isEmpty() || outcome.lines().equals(lines)) {
                    break;
                }
                details.addAll(outcome.details());
                lines = outcome.lines();
            }
            if (details.isEmpty()) {
                return LineFixResult.unchanged(mode, translated);
            }
            String content = LatexLines.join(lines);
            LOGGER.info("Reference-based repair ({}) applied {} fix(es)", mode, details.size());
            details.forEach(detail -> LOGGER.debug("  {}", detail));
            return new LineFixResult(mode, details.size(), details, content);
        } catch (RuntimeException ex) {
            LOGGER.warn("Reference-based repair failed; keeping the translation unchanged", ex);
            return LineFixResult.unchanged(mode, translated);
        }
    }
}
