package eu.virtualparadox.finrag.support;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;

/**
 * Heap-backed Lucene index wired the same way as the application index.
 */
public final class InMemoryIndex implements AutoCloseable {

    private final ByteBuffersDirectory directory = new ByteBuffersDirectory();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    public InMemoryIndex() throws IOException {
        this.writer = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()));
        this.writer.commit();
        this.searcherManager = new SearcherManager(writer, null);
    }

    public IndexWriter writer() {
        return writer;
    }

    public SearcherManager searcherManager() {
        return searcherManager;
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }
}
