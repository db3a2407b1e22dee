package ai.latex.translator.pipeline;

import java.util.Locale;

/**
 * Repair stages in the order the pipeline runs them.
 */
public enum RepairStage {
    SIMPLE_FIX,
    REFERENCE_FIX,
    LLM_FIX,
    RESTORED_BACKUP;

    /** Lower-case name used in log context, e.g. {@code reference-fix}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
