package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.exception.VectorStoreException;
import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static eu.virtualparadox.finrag.util.LuceneConstants.FIELD_TEXT_LOWER;

/**
 * Case-insensitive substring match on chunk text.
 * <p>Every match scores exactly {@value #MATCH_SCORE}; matches are returned in index order.</p>
 */
@Service
@RequiredArgsConstructor
public final class KeywordRetrieverService implements RetrieverService {

    static final double MATCH_SCORE = 1.0;

    private final SearcherManager searcherManager;

    @Override
    public List<SearchResult> search(final String query, final int k) {
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }

        final Query wildcard = new WildcardQuery(new Term(FIELD_TEXT_LOWER,
                "*" + escape(query.toLowerCase(Locale.ROOT)) + "*"));

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final int hits = SearchResults.cappedHits(searcher, k);
                if (hits == 0) {
                    return List.of();
                }
                final TopDocs topDocs = searcher.search(new ConstantScoreQuery(wildcard), hits);
                final List<SearchResult> results = new ArrayList<>();
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    results.add(SearchResults.from(searcher.storedFields().document(sd.doc), MATCH_SCORE));
                }
                return results;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new VectorStoreException("searchKeyword", e);
        }
    }

    /**
     * Escapes the wildcard syntax so the query matches literally.
     */
    static String escape(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == WildcardQuery.WILDCARD_STRING || c == WildcardQuery.WILDCARD_CHAR || c == WildcardQuery.WILDCARD_ESCAPE) {
                sb.append(WildcardQuery.WILDCARD_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
