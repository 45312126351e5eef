package eu.virtualparadox.finrag.ingest.extractor;

import eu.virtualparadox.finrag.exception.ExtractionException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfPageExtractorTest {

    @TempDir
    Path tempDir;

    private final PdfPageExtractor extractor = new PdfPageExtractor();

    /**
     * Writes a PDF with one page per entry; a {@code null} entry produces a blank page.
     */
    private Path writePdf(final String... pageTexts) throws IOException {
        final Path path = tempDir.resolve("report.pdf");
        try (PDDocument doc = new PDDocument()) {
            for (final String text : pageTexts) {
                final PDPage page = new PDPage();
                doc.addPage(page);
                if (text != null) {
                    try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                        cs.beginText();
                        cs.setFont(PDType1Font.HELVETICA, 12);
                        cs.newLineAtOffset(72, 700);
                        cs.showText(text);
                        cs.endText();
                    }
                }
            }
            doc.save(path.toFile());
        }
        return path;
    }

    @Test
    @DisplayName("Pages are returned in document order with their own text and counts")
    void extract_returnsPagesInOrder() throws IOException {
        final Path pdf = writePdf("Fund overview and strategy", "Top ten holdings", "Fees and expenses");

        final List<RawPage> pages = extractor.extract(pdf);

        assertEquals(3, pages.size());
        assertEquals(List.of(1, 2, 3), pages.stream().map(RawPage::pageNumber).toList());
        assertTrue(pages.get(0).text().contains("Fund overview"));
        assertTrue(pages.get(1).text().contains("holdings"));
        assertTrue(pages.get(2).text().contains("Fees"));
        assertEquals(4, pages.get(0).wordCount());
        assertEquals(pages.get(2).text().length(), pages.get(2).charCount());
    }

    @Test
    @DisplayName("A page without text yields empty text, not a missing page")
    void extract_blankPage() throws IOException {
        final Path pdf = writePdf("First", null, "Third");

        final List<RawPage> pages = extractor.extract(pdf);

        assertEquals(3, pages.size());
        assertNotNull(pages.get(1).text());
        assertTrue(pages.get(1).text().isBlank());
        assertEquals(0, pages.get(1).wordCount());
    }

    @Test
    @DisplayName("A file that is not a PDF fails the whole extraction")
    void extract_notAPdf() throws IOException {
        final Path notPdf = tempDir.resolve("report.pdf");
        Files.writeString(notPdf, "<html>not found</html>");

        final ExtractionException ex = assertThrows(ExtractionException.class, () -> extractor.extract(notPdf));
        assertEquals(notPdf, ex.getPath());
    }

    @Test
    @DisplayName("A missing file fails the whole extraction")
    void extract_missingFile() {
        assertThrows(ExtractionException.class, () -> extractor.extract(tempDir.resolve("missing.pdf")));
    }
}
