package ai.latex.translator.completeness;

/**
 * Page counts of both PDFs. The translation is suspicious when it lost more than the threshold share
 * of the original's pages.
 */
public record PageCountResult(int originalPages, int translatedPages, double dropRatio, boolean suspicious) {

    public static final double DROP_THRESHOLD = 0.15;

    public static PageCountResult of(int originalPages, int translatedPages) {
        if (originalPages <= 0) {
            return new PageCountResult(originalPages, translatedPages, 0.0, false);
        }
        double drop = (double) (originalPages - translatedPages) / originalPages;
        return new PageCountResult(originalPages, translatedPages, drop, drop > DROP_THRESHOLD);
    }

    public String describe() {
        return String.format("Translated PDF has %d page(s), original has %d (%.0f%% fewer)",
                translatedPages, originalPages, dropRatio * 100);
    }
}
