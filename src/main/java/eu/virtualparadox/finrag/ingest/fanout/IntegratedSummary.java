package eu.virtualparadox.finrag.ingest.fanout;

import java.util.List;

/**
 * Document level digest of the optional {@code keywords}, {@code summary} and {@code category} fields
 * that the model returned per page.
 *
 * @param totalPagesProcessed successful pages that were scanned
 * @param combinedKeywords    distinct keywords in first-seen order
 * @param combinedSummary     page summaries joined with a single space
 * @param pageSummaries       page summaries in page order
 * @param categories          distinct categories in first-seen order
 * @param error               set when no page succeeded, otherwise {@code null}
 */
public record IntegratedSummary(int totalPagesProcessed,
                                List<String> combinedKeywords,
                                String combinedSummary,
                                List<PageSummary> pageSummaries,
                                List<String> categories,
                                String error) {

    public static IntegratedSummary empty(final String error) {
        return new IntegratedSummary(0, List.of(), "", List.of(), List.of(), error);
    }

    public boolean isEmpty() {
        return totalPagesProcessed == 0;
    }
}
