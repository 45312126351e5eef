package eu.virtualparadox.finrag.ingest.fanout;

import eu.virtualparadox.finrag.ingest.page.PageFailure;
import eu.virtualparadox.finrag.ingest.page.PageResult;

import java.util.List;

/**
 * Settled outcome of a fan-out over all pages of one document.
 * <p>{@code totalPages == successfulPages + failedPages.size()} and
 * {@code successfulPages == pageResults.size()} always hold; both lists are in ascending page order.</p>
 */
public record ProcessingResult(int totalPages,
                               int successfulPages,
                               List<Integer> failedPages,
                               List<PageFailure> failures,
                               List<PageResult> pageResults,
                               IntegratedSummary integratedSummary) {

    public ProcessingResult {
        failedPages = List.copyOf(failedPages);
        failures = List.copyOf(failures);
        pageResults = List.copyOf(pageResults);
        if (successfulPages != pageResults.size() || totalPages != successfulPages + failedPages.size()) {
            throw new IllegalStateException("Inconsistent page counts: total=" + totalPages
                    + ", successful=" + successfulPages + ", failed=" + failedPages.size());
        }
    }
}
