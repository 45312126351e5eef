package eu.virtualparadox.finrag.rag.retriever.model;

/**
 * @param chunkId         identifier of the chunk, {@code ticker_NNNN}
 * @param ticker          ticker the chunk belongs to
 * @param chunkNumber     1-based position of the chunk in its report
 * @param content         chunk text
 * @param documentId      catalog id of the source report
 * @param filename        file name of the source report
 * @param score           similarity for vector search, 1.0 for keyword matches, weighted sum for hybrid
 */
public record SearchResult(String chunkId,
                           String ticker,
                           int chunkNumber,
                           String content,
                           String documentId,
                           String filename,
                           double score) {

    public SearchResult withScore(final double newScore) {
        return new SearchResult(chunkId, ticker, chunkNumber, content, documentId, filename, newScore);
    }
}
