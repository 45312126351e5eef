package eu.virtualparadox.finrag.rag.index;

import eu.virtualparadox.finrag.exception.VectorStoreException;
import eu.virtualparadox.finrag.rag.chunk.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.*;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static eu.virtualparadox.finrag.util.LuceneConstants.*;

/**
 * Lucene implementation of {@link VectorIndexService} on an HNSW {@link KnnFloatVectorField} with cosine similarity.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code ticker}, {@code chunkId}: {@link StringField}, stored: identity and the only filter readers use</li>
 *   <li>{@code chunkNumber}, {@code totalPages}, {@code successfulPages}: stored ints</li>
 *   <li>{@code text}: {@link TextField}, stored: the chunk content</li>
 *   <li>{@code textLower}: {@link StringField}: lowercased content for substring search, at most
 *   {@link IndexWriter#MAX_TERM_LENGTH} UTF-8 bytes</li>
 *   <li>{@code documentId}, {@code filename}: stored only</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField}</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * Dimension of the first vectors written by this instance; later writes must match.
     */
    private Integer vectorDim;

    @Override
    public synchronized int replaceTicker(final String ticker, final List<Chunk> chunks, final List<float[]> vectors) {
        requireNonNullOrEmpty(ticker, "ticker");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (int i = 0; i < chunks.size(); i++) {
            final float[] v = vectors.get(i);
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
            if (!ticker.equals(chunks.get(i).ticker())) {
                throw new IllegalArgumentException("Chunk " + chunks.get(i).chunkId() + " does not belong to " + ticker);
            }
        }

        final List<Document> docs = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            docs.add(buildLuceneDocument(chunks.get(i), vectors.get(i)));
        }

        try {
            // delete-by-ticker and the new block are applied together or not at all
            writer.updateDocuments(new Term(FIELD_TICKER, ticker), docs);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new VectorStoreException("replaceTicker(" + ticker + ")", e);
        }

        log.info("Indexed {} chunk(s) for {}", chunks.size(), ticker);
        return chunks.size();
    }

    @Override
    public synchronized long deleteByTicker(final String ticker) {
        requireNonNullOrEmpty(ticker, "ticker");
        try {
            final long existing = countByTicker(ticker);
            writer.deleteDocuments(new Term(FIELD_TICKER, ticker));
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            log.info("Deleted {} chunk(s) of {}", existing, ticker);
            return existing;
        } catch (IOException e) {
            throw new VectorStoreException("deleteByTicker(" + ticker + ")", e);
        }
    }

    @Override
    public long countByTicker(final String ticker) {
        return countQuery(new TermQuery(new Term(FIELD_TICKER, ticker)), "countByTicker(" + ticker + ")");
    }

    @Override
    public long count() {
        return countQuery(new MatchAllDocsQuery(), "count");
    }

    private long countQuery(final Query query, final String operation) {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(query);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new VectorStoreException(operation, e);
        }
    }

    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final Chunk c, final float[] vec) {
        final String lower = c.content().toLowerCase(Locale.ROOT);
        final int termBytes = lower.getBytes(StandardCharsets.UTF_8).length;
        if (termBytes > IndexWriter.MAX_TERM_LENGTH) {
            throw new IllegalArgumentException("Chunk " + c.chunkId() + " is " + termBytes
                    + " bytes, the keyword field allows " + IndexWriter.MAX_TERM_LENGTH);
        }

        final Document d = new Document();

        d.add(new StringField(FIELD_TICKER, c.ticker(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));
        d.add(new StoredField(FIELD_CHUNK_NUMBER, c.chunkNumber()));

        d.add(new TextField(FIELD_TEXT, c.content(), Field.Store.YES));
        d.add(new StringField(FIELD_TEXT_LOWER, lower, Field.Store.NO));

        d.add(new StoredField(FIELD_DOCUMENT_ID, nullToEmpty(c.documentId())));
        d.add(new StoredField(FIELD_FILENAME, nullToEmpty(c.filename())));
        d.add(new StoredField(FIELD_TOTAL_PAGES, c.totalPages()));
        d.add(new StoredField(FIELD_SUCCESSFUL_PAGES, c.successfulPages()));

        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));

        return d;
    }

    private static String nullToEmpty(final String s) {
        return s == null ? "" : s;
    }

    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
