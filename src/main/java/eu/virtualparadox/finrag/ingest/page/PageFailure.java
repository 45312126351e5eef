package eu.virtualparadox.finrag.ingest.page;

/**
 * @param pageNumber page that could not be processed
 * @param error      message of the underlying failure
 */
public record PageFailure(int pageNumber, String error) implements PageOutcome {
}
