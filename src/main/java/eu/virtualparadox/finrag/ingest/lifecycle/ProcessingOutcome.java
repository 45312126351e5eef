package eu.virtualparadox.finrag.ingest.lifecycle;

import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.ingest.fanout.IntegratedSummary;

import java.time.Instant;
import java.util.List;

/**
 * What one pipeline run wrote to the catalog.
 */
public record ProcessingOutcome(String ticker,
                                String documentId,
                                String sourceUrl,
                                String filename,
                                long fileSize,
                                int totalPages,
                                int successfulPages,
                                List<Integer> failedPages,
                                ESuccessFlag successFlag,
                                IntegratedSummary integratedSummary,
                                Instant processedAt) {
}
