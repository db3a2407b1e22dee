package ai.latex.translator.completeness;

import java.util.Objects;

/**
 * A line of text extracted from a PDF page.
 *
 * @param heading whether the extractor identified the line as a heading
 */
public record TextBlock(int page, String text, boolean heading) {

    public TextBlock {
        Objects.requireNonNull(text, "text");
        if (page < 1) {
            throw new IllegalArgumentException("page is 1-based");
        }
    }

    public TextBlock(int page, String text) {
        this(page, text, false);
    }
}
