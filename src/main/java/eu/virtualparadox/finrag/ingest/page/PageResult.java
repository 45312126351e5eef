package eu.virtualparadox.finrag.ingest.page;

import java.time.Instant;

public record PageResult(int pageNumber,
                         int charCount,
                         int wordCount,
                         ParsedContent parsedContent,
                         Instant processedAt) implements PageOutcome {
}
