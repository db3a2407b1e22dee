package ai.latex.translator.reference;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a reference-based repair. {@code fixDetails} entries read {@code "L<n>: <what changed>"}
 * where the change is tied to a line.
 */
public record LineFixResult(RepairMode mode, int fixCount, List<String> fixDetails, String content) {

    public LineFixResult {
        Objects.requireNonNull(mode, "mode");
        fixDetails = List.copyOf(Objects.requireNonNull(fixDetails, "fixDetails"));
        Objects.requireNonNull(content, "content");
        if (fixCount != fixDetails.size()) {
            throw new IllegalArgumentException("fixCount must match the number of fix details");
        }
    }

    public static LineFixResult unchanged(RepairMode mode, String content) {
        return new LineFixResult(mode, 0, List.of(), content);
    }

    public boolean changed() {
        return fixCount > 0;
    }
}
