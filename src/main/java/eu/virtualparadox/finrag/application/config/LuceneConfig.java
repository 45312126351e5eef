package eu.virtualparadox.finrag.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages the Lucene resources backing the chunk vector index.
 * <p>Resources are opened against the on-disk index under {@code finrag.index} and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    /**
     * Opens the directory holding the chunk index, creating {@code finrag.index} when missing.
     *
     * @param props filesystem layout bound from {@code finrag.*}
     * @return opened {@link Directory}
     * @throws IOException if the folder cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        return this.directory;
    }

    /**
     * Analyzer for the tokenised chunk text field. Keyword search does not use it, it matches the
     * lowercased untokenised copy instead.
     *
     * @return {@link StandardAnalyzer} instance
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    /**
     * The single writer every ticker replace and delete goes through.
     *
     * @param dir      chunk index directory
     * @param analyzer text analyzer
     * @return {@link IndexWriter} in create-or-append mode, with an initial commit
     * @throws IOException on writer creation error
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        // make the (possibly empty) index readable before the first chunk is written
        this.indexWriter.commit();
        return this.indexWriter;
    }

    /**
     * Near-real-time searchers for the retrievers, refreshed after each index commit.
     *
     * @param writer index writer
     * @return {@link SearcherManager}
     * @throws IOException on failure
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    /**
     * Closes searchers, writer, analyzer and directory in that order on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
