package ai.latex.translator.reference;

/**
 * Strategy picked by {@link ReferenceBasedFixer}: line-aligned when both documents have the same
 * number of physical lines, structural otherwise.
 */
public enum RepairMode {
    LINE_ALIGNED,
    STRUCTURAL;

    public static RepairMode select(int translatedLines, int originalLines) {
        return translatedLines == originalLines ? LINE_ALIGNED : STRUCTURAL;
    }
}
