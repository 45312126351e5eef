package eu.virtualparadox.finrag.rag.chunk;

import java.util.Locale;

/**
 * One window of a report body, tagged for the vector index. Identity is the ticker plus the sequence number.
 */
public record Chunk(String ticker,
                    int chunkNumber,
                    String chunkId,
                    String content,
                    String documentId,
                    String filename,
                    int totalPages,
                    int successfulPages) {

    /**
     * @return {@code ticker_NNNN}, the chunk number zero-padded to four digits
     */
    public static String chunkId(final String ticker, final int chunkNumber) {
        return ticker + "_" + String.format(Locale.ROOT, "%04d", chunkNumber);
    }
}
