package eu.virtualparadox.finrag.ingest.page;

/**
 * Result of processing a single page: a {@link PageResult} or an isolated {@link PageFailure}.
 */
public sealed interface PageOutcome permits PageResult, PageFailure {

    int pageNumber();
}
