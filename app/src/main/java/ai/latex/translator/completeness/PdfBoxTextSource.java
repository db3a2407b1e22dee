package ai.latex.translator.completeness;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Reads PDFs with Apache PDFBox, one block per non-blank text line.
 */
public class PdfBoxTextSource implements PdfTextSource {

    @Override
    public int pageCount(Path pdf) {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            return document.getNumberOfPages();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open PDF: " + pdf, ex);
        }
    }

    @Override
    public List<TextBlock> extractBlocks(Path pdf) {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<TextBlock> blocks = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                for (String line : stripper.getText(document).split("\\R")) {
                    if (!line.isBlank()) {
                        blocks.add(new TextBlock(page, line.strip()));
                    }
                }
            }
            return blocks;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to extract text from PDF: " + pdf, ex);
        }
    }
}
