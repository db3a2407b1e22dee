package ai.latex.translator.validate;

import java.util.Objects;
import java.util.Optional;

/**
 * One structural finding. Document-wide findings use line and column 0.
 *
 * @param delta signed brace surplus, positive when openings are left unclosed
 */
public record ValidationIssue(Severity severity,
                              IssueType type,
                              IssueCode code,
                              int line,
                              int column,
                              String message,
                              String details,
                              Optional<Integer> delta) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        details = details == null ? "" : details;
        delta = delta == null ? Optional.empty() : delta;
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must not be negative");
        }
    }

    public static ValidationIssue error(IssueType type, IssueCode code, int line, int column, String message) {
        return new ValidationIssue(Severity.ERROR, type, code, line, column, message, "", Optional.empty());
    }

    public static ValidationIssue warning(IssueType type, IssueCode code, int line, int column, String message) {
        return new ValidationIssue(Severity.WARNING, type, code, line, column, message, "", Optional.empty());
    }

    public ValidationIssue withDetails(String newDetails) {
        return new ValidationIssue(severity, type, code, line, column, message, newDetails, delta);
    }

    public ValidationIssue withDelta(int newDelta) {
        return new ValidationIssue(severity, type, code, line, column, message, details, Optional.of(newDelta));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String describe() {
        String location = line > 0 ? "line " + line + ", column " + column : "document";
        return "[" + severity.label() + "] " + location + ": " + message;
    }
}
