package eu.virtualparadox.finrag.ingest.extractor;

import java.nio.file.Path;
import java.util.List;

public interface PageExtractor {

    /**
     * @param path PDF file on local disk
     * @return pages in document order, numbered from 1
     * @throws eu.virtualparadox.finrag.exception.ExtractionException if the file is unreadable or not a PDF
     */
    List<RawPage> extract(final Path path);

}
