package eu.virtualparadox.finrag.ingest.extractor;

import eu.virtualparadox.finrag.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox extractor that strips one page at a time so every page keeps its own text and counts.
 * <p>Either the whole document is extracted or an {@link ExtractionException} is thrown; there is no
 * partial result.</p>
 */
@Service
@Slf4j
public final class PdfPageExtractor implements PageExtractor {

    @Override
    public List<RawPage> extract(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final List<RawPage> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageTextRaw = stripper.getText(pdf);
                final String pageText = Normalizer.normalize(pageTextRaw, Normalizer.Form.NFC);
                pages.add(RawPage.of(page, pageText));
            }

            log.info("Extracted {} page(s) from {}", pageCount, path.getFileName());
            return pages;
        }
        catch (Exception e) {
            throw new ExtractionException(path, e);
        }
    }
}
