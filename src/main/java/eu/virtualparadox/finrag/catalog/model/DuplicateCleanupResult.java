package eu.virtualparadox.finrag.catalog.model;

/**
 * @param duplicateTickerCount tickers that had more than one report
 * @param totalRemoved         reports deleted across those tickers
 */
public record DuplicateCleanupResult(int duplicateTickerCount, int totalRemoved) {
}
