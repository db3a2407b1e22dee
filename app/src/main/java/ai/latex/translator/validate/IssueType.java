package ai.latex.translator.validate;

import java.util.Locale;

/**
 * Category of a structural finding.
 */
public enum IssueType {
    BRACE,
    BRACKET,
    MATH,
    ENVIRONMENT,
    DOCUMENT,
    INCLUDE,
    TYPO,
    COMMAND;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
