package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.exception.VectorStoreException;
import eu.virtualparadox.finrag.rag.embed.EmbeddingService;
import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.apache.lucene.search.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.finrag.util.LuceneConstants.FIELD_VECTOR;

/**
 * Nearest-neighbour search over the chunk embeddings.
 * <p>
 * Steps:
 * <ol>
 *   <li>Cap {@code k} at the number of indexed chunks; an empty index answers without embedding</li>
 *   <li>Embed the query using {@link EmbeddingService}</li>
 *   <li>Run an ANN search with {@link KnnFloatVectorQuery}</li>
 *   <li>Convert Lucene's {@code (1 + cos) / 2} score back to the cosine similarity</li>
 * </ol>
 * Results come back in descending similarity.
 */
@Service
@RequiredArgsConstructor
public final class KnnRetrieverService implements RetrieverService {

    private final EmbeddingService embeddingService;
    private final SearcherManager searcherManager;

    @Override
    public List<SearchResult> search(final String query, final int k) {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final int hits = SearchResults.cappedHits(searcher, k);
                if (hits == 0) {
                    return List.of();
                }

                final float[] vector = embeddingService.embedQuery(query);
                final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, hits);
                final TopDocs topDocs = searcher.search(knn, hits);

                final List<SearchResult> results = new ArrayList<>();
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    results.add(SearchResults.from(searcher.storedFields().document(sd.doc), toCosine(sd.score)));
                }
                return results;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new VectorStoreException("searchVector", e);
        }
    }

    static double toCosine(final float luceneScore) {
        return 2.0 * luceneScore - 1.0;
    }
}
