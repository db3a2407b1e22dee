package ai.latex.translator.validate;

/**
 * Precise reason behind a finding, used by fixers to pick their rules.
 */
public enum IssueCode {
    UNMATCHED_OPENING,
    UNMATCHED_CLOSING,
    ENVIRONMENT_MISMATCH,
    UNCLOSED_ENVIRONMENT,
    UNMATCHED_END,
    MISSING_DOCUMENTCLASS,
    MISSING_BEGIN_DOCUMENT,
    MISSING_END_DOCUMENT,
    CONTENT_AFTER_END_DOCUMENT,
    MISSING_INCLUDE,
    KNOWN_TYPO,
    DEEP_NESTING,
    INCOMPLETE_DEFINITION
}
