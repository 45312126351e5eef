package eu.virtualparadox.finrag.rag.pipeline;

/**
 * Outcome of embedding one ticker. A failed result means the vector index was not touched.
 */
public record EmbeddingResult(boolean success,
                              String message,
                              String ticker,
                              int chunksCount,
                              DocumentInfo documentInfo) {

    public static EmbeddingResult failure(final String ticker, final String message) {
        return new EmbeddingResult(false, message, ticker, 0, null);
    }
}
