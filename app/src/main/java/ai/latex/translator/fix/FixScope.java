package ai.latex.translator.fix;

/**
 * How much of the rule catalog {@link SimpleFixer} may apply.
 */
public enum FixScope {
    /** Every rule, including the coarse brace balancing and the final-newline rewrite. */
    ALL,
    /**
     * Only rules that keep the physical line layout (typos, line endings, trailing whitespace). Used
     * ahead of the reference-based repair, which aligns lines with the original.
     */
    LINE_PRESERVING
}
