package ai.latex.translator.fix;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record FixResult(boolean fixed, List<String> fixesApplied, Optional<Path> backupPath, String content) {

    public FixResult {
        fixesApplied = List.copyOf(Objects.requireNonNull(fixesApplied, "fixesApplied"));
        backupPath = backupPath == null ? Optional.empty() : backupPath;
        content = Objects.requireNonNull(content, "content");
    }

    public static FixResult unchanged(String content) {
        return new FixResult(false, List.of(), Optional.empty(), content);
    }

    FixResult withBackup(Path backup) {
        return new FixResult(fixed, fixesApplied, Optional.of(backup), content);
    }
}
