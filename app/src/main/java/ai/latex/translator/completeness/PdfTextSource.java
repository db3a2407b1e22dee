package ai.latex.translator.completeness;

import java.nio.file.Path;
import java.util.List;

/**
 * Supplies page counts and text lines of compiled PDFs.
 */
public interface PdfTextSource {

    int pageCount(Path pdf);

    List<TextBlock> extractBlocks(Path pdf);
}
