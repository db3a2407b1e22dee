package ai.latex.translator.validate;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Finding projected into the shape handed to the LLM fixer.
 */
public record SyntaxError(int line, int column, String message, IssueType type) {

    static final Set<IssueType> TYPES = EnumSet.of(IssueType.BRACE, IssueType.BRACKET, IssueType.MATH,
            IssueType.ENVIRONMENT);

    public SyntaxError {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(type, "type");
    }

    public static SyntaxError from(ValidationIssue issue) {
        return new SyntaxError(issue.line(), issue.column(), issue.message(), issue.type());
    }
}
