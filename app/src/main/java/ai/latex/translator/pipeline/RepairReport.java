package ai.latex.translator.pipeline;

import ai.latex.translator.validate.ValidationIssue;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one validate-and-repair cycle for a single document.
 *
 * @param content document content on disk when the cycle finished
 */
public record RepairReport(boolean valid,
                           List<RepairStage> stagesApplied,
                           List<String> fixesApplied,
                           List<ValidationIssue> remainingIssues,
                           String content) {

    public RepairReport {
        stagesApplied = List.copyOf(Objects.requireNonNull(stagesApplied, "stagesApplied"));
        fixesApplied = List.copyOf(Objects.requireNonNull(fixesApplied, "fixesApplied"));
        remainingIssues = List.copyOf(Objects.requireNonNull(remainingIssues, "remainingIssues"));
        Objects.requireNonNull(content, "content");
    }

    public boolean changed() {
        return !stagesApplied.isEmpty();
    }
}
