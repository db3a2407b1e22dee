package ai.latex.translator.validate;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a validation run. The document is valid when no error-severity finding remains.
 */
public record ValidationResult(boolean valid, List<ValidationIssue> issues) {

    public ValidationResult {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        boolean valid = issues.stream().noneMatch(ValidationIssue::isError);
        return new ValidationResult(valid, issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    public boolean has(IssueCode code) {
        return issues.stream().anyMatch(issue -> issue.code() == code);
    }

    public List<ValidationIssue> issuesOfType(IssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).toList();
    }

    /**
     * Structural findings (brace, bracket, math and environment) in the shape the LLM fixer takes.
     */
    public List<SyntaxError> toSyntaxErrors() {
        return issues.stream()
                .filter(issue -> SyntaxError.TYPES.contains(issue.type()))
                .map(SyntaxError::from)
                .toList();
    }

    public String summary() {
        if (issues.isEmpty()) {
            return "no issues";
        }
        return errors().size() + " error(s), " + warnings().size() + " warning(s): "
                + issues.stream().map(ValidationIssue::describe).collect(Collectors.joining("; "));
    }
}
