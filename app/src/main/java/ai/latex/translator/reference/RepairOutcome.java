package ai.latex.translator.reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Lines produced by a repair strategy together with the fixes it recorded.
 */
record RepairOutcome(List<String> lines, List<String> details) {

    RepairOutcome {
        lines = List.copyOf(lines);
        details = List.copyOf(details);
    }

    RepairOutcome then(RepairOutcome next) {
        List<String> combined = new ArrayList<>(details);
        combined.addAll(next.details());
        return new RepairOutcome(next.lines(), combined);
    }
}
