package eu.virtualparadox.finrag.util;

/**
 * Field names of the chunk documents in the Lucene index. Every writer and reader uses these.
 */
public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_TICKER = "ticker";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_CHUNK_NUMBER = "chunkNumber";
    public static final String FIELD_TEXT = "text";
    /** Lowercased copy of the chunk text, indexed as a single term for substring matching. */
    public static final String FIELD_TEXT_LOWER = "textLower";
    public static final String FIELD_DOCUMENT_ID = "documentId";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_TOTAL_PAGES = "totalPages";
    public static final String FIELD_SUCCESSFUL_PAGES = "successfulPages";

    private LuceneConstants() {
        // prevent instantiation
    }
}
