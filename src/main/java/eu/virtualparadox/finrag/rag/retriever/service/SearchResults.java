package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.search.IndexSearcher;

import static eu.virtualparadox.finrag.util.LuceneConstants.*;

/**
 * Maps stored chunk fields back to {@link SearchResult}.
 */
final class SearchResults {

    private SearchResults() {
        // prevent instantiation
    }

    /**
     * Caps a requested hit count at the number of live chunks, so that collectors sized by {@code k}
     * never grow past the index.
     *
     * @return {@code 0} when the index is empty
     */
    static int cappedHits(final IndexSearcher searcher, final int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive");
        }
        return Math.min(k, searcher.getIndexReader().numDocs());
    }

    static SearchResult from(final Document doc, final double score) {
        return new SearchResult(
                doc.get(FIELD_CHUNK_ID),
                doc.get(FIELD_TICKER),
                intField(doc, FIELD_CHUNK_NUMBER),
                doc.get(FIELD_TEXT),
                doc.get(FIELD_DOCUMENT_ID),
                doc.get(FIELD_FILENAME),
                score);
    }

    private static int intField(final Document doc, final String name) {
        final IndexableField field = doc.getField(name);
        return field == null || field.numericValue() == null ? 0 : field.numericValue().intValue();
    }
}
