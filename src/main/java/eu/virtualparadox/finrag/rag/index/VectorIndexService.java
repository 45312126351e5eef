package eu.virtualparadox.finrag.rag.index;

import eu.virtualparadox.finrag.rag.chunk.Chunk;

import java.util.List;

/**
 * Vector index holding the chunks of every ticker.
 * <p>
 * Chunks of a ticker are only ever replaced as a whole:
 * <ul>
 *   <li><b>Replace</b> removes every chunk of the ticker and writes the new ones in one commit</li>
 *   <li><b>Delete</b> removes every chunk of the ticker</li>
 * </ul>
 * All vectors in the index share one dimension.
 */
public interface VectorIndexService {

    /**
     * @param ticker  ticker whose chunks are replaced (non-blank)
     * @param chunks  new chunks, every one tagged with {@code ticker}
     * @param vectors one vector per chunk, same order
     * @return number of chunks written
     * @throws eu.virtualparadox.finrag.exception.VectorStoreException if the index write fails
     */
    int replaceTicker(final String ticker, final List<Chunk> chunks, final List<float[]> vectors);

    /**
     * @return number of chunks removed
     */
    long deleteByTicker(final String ticker);

    long countByTicker(final String ticker);

    long count();
}
