package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hybrid retriever: blends vector and keyword search.
 * <p>
 * Steps:
 * <ol>
 *   <li>Run vector search and keyword search independently, each oversampled to {@code 2 * limit}</li>
 *   <li>Multiply every score by the weight of the search that produced it</li>
 *   <li>Sum the weighted scores of results sharing a {@code chunkId}</li>
 *   <li>Sort by combined score (ties by chunk id) and keep the top {@code limit}</li>
 * </ol>
 * Weights are not normalised and need not sum to 1.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HybridRetrieverService {

    public static final double DEFAULT_VECTOR_WEIGHT = 0.7;
    public static final double DEFAULT_KEYWORD_WEIGHT = 0.3;

    private final KnnRetrieverService knnRetriever;
    private final KeywordRetrieverService keywordRetriever;

    public List<SearchResult> search(final String query,
                                     final int limit,
                                     final double vectorWeight,
                                     final double keywordWeight) {
        requireWeight(vectorWeight, "vectorWeight");
        requireWeight(keywordWeight, "keywordWeight");

        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }

        final int oversampled = Math.min(limit, Integer.MAX_VALUE / 2) * 2;
        final List<SearchResult> vectorHits = knnRetriever.search(query, oversampled);
        final List<SearchResult> keywordHits = keywordRetriever.search(query, oversampled);

        final Map<String, SearchResult> fused = new LinkedHashMap<>();
        accumulate(vectorHits, fused, vectorWeight);
        accumulate(keywordHits, fused, keywordWeight);

        log.debug("Hybrid search '{}': {} vector hit(s), {} keyword hit(s), {} fused",
                query, vectorHits.size(), keywordHits.size(), fused.size());

        return fused.values().stream()
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed()
                        .thenComparing(SearchResult::chunkId))
                .limit(limit)
                .toList();
    }

    private void accumulate(final List<SearchResult> hits,
                            final Map<String, SearchResult> fused,
                            final double weight) {
        for (final SearchResult hit : hits) {
            final SearchResult weighted = hit.withScore(hit.score() * weight);
            fused.merge(hit.chunkId(), weighted, (a, b) -> a.withScore(a.score() + b.score()));
        }
    }

    private void requireWeight(final double weight, final String name) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
    }
}
