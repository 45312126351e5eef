package eu.virtualparadox.finrag.catalog.model;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Every field of a report that an upsert writes. Timestamps and the success flag are owned by the catalog.
 */
@Builder
public record ReportDraft(String filename,
                          String sourceUrl,
                          long fileSize,
                          String contentType,
                          Instant downloadTime,
                          String promptType,
                          String parsedContent,
                          String summary,
                          int totalPages,
                          int successfulPages,
                          List<Integer> failedPages,
                          EDocumentStatus status) {
}
