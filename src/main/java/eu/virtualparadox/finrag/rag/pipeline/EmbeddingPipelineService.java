package eu.virtualparadox.finrag.rag.pipeline;

import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.entity.ReportDocumentEntity;
import eu.virtualparadox.finrag.catalog.service.DocumentCatalogService;
import eu.virtualparadox.finrag.exception.EmbeddingPreconditionException;
import eu.virtualparadox.finrag.rag.chunk.Chunk;
import eu.virtualparadox.finrag.rag.chunk.RecursiveCharacterChunker;
import eu.virtualparadox.finrag.rag.embed.EmbeddingService;
import eu.virtualparadox.finrag.rag.index.VectorIndexService;
import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import eu.virtualparadox.finrag.rag.retriever.service.HybridRetrieverService;
import eu.virtualparadox.finrag.rag.retriever.service.KeywordRetrieverService;
import eu.virtualparadox.finrag.rag.retriever.service.KnnRetrieverService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.index.IndexWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunks and embeds stored reports and answers searches over their chunks.
 * <p>
 * Embedding a ticker is a full replace: the report is chunked from scratch and every chunk previously
 * indexed for the ticker is removed in the same commit that adds the new ones. Only reports whose pages
 * all parsed successfully are embedded.
 * </p>
 */
@Service
@Slf4j
public class EmbeddingPipelineService {

    /**
     * Largest chunk size whose worst case of 3 UTF-8 bytes per char still fits one Lucene term.
     */
    static final int MAX_CHUNK_SIZE = IndexWriter.MAX_TERM_LENGTH / 3;

    private final DocumentCatalogService catalogService;
    private final RecursiveCharacterChunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndex;
    private final KnnRetrieverService knnRetriever;
    private final KeywordRetrieverService keywordRetriever;
    private final HybridRetrieverService hybridRetriever;
    private final int chunkSize;
    private final int chunkOverlap;

    public EmbeddingPipelineService(final DocumentCatalogService catalogService,
                                    final RecursiveCharacterChunker chunker,
                                    final EmbeddingService embeddingService,
                                    final VectorIndexService vectorIndex,
                                    final KnnRetrieverService knnRetriever,
                                    final KeywordRetrieverService keywordRetriever,
                                    final HybridRetrieverService hybridRetriever,
                                    @Value("${finrag.chunk.size:1024}") final int chunkSize,
                                    @Value("${finrag.chunk.overlap:512}") final int chunkOverlap) {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap > chunkSize) {
            throw new IllegalArgumentException("Invalid chunk settings: size=" + chunkSize + ", overlap=" + chunkOverlap);
        }
        if (chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("chunk size " + chunkSize + " exceeds " + MAX_CHUNK_SIZE
                    + ", chunks must fit one keyword term");
        }
        this.catalogService = catalogService;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.knnRetriever = knnRetriever;
        this.keywordRetriever = keywordRetriever;
        this.hybridRetriever = hybridRetriever;
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * Replaces the indexed chunks of a ticker with fresh chunks of its stored report.
     *
     * @return a failure result, with the index untouched, when the ticker has no report, the report is
     * not {@link ESuccessFlag#COMPLETE} or its content is blank
     */
    public EmbeddingResult embedAndStore(final String ticker) {
        final ReportDocumentEntity report;
        try {
            report = requireEmbeddable(ticker);
        } catch (EmbeddingPreconditionException e) {
            log.warn("Embedding of {} rejected: {}", ticker, e.getMessage());
            return EmbeddingResult.failure(ticker, e.getMessage());
        }

        final List<String> texts = chunker.chunk(report.getParsedContent(), chunkSize, chunkOverlap);
        final List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            final int number = i + 1;
            chunks.add(new Chunk(ticker, number, Chunk.chunkId(ticker, number), texts.get(i),
                    report.getId(), report.getFilename(), report.getTotalPages(), report.getSuccessfulPages()));
        }

        final List<float[]> vectors = embeddingService.embed(texts);
        final int written = vectorIndex.replaceTicker(ticker, chunks, vectors);

        log.info("Embedded report {} of {} into {} chunk(s)", report.getId(), ticker, written);
        return new EmbeddingResult(true, "Stored " + written + " chunk(s) for " + ticker, ticker, written,
                new DocumentInfo(report.getId(), report.getFilename(), report.getTotalPages(), report.getSuccessfulPages()));
    }

    public List<SearchResult> searchVector(final String query, final int limit) {
        requireLimit(limit);
        return knnRetriever.search(query, limit);
    }

    public List<SearchResult> searchKeyword(final String query, final int limit) {
        requireLimit(limit);
        return keywordRetriever.search(query, limit);
    }

    public List<SearchResult> searchHybrid(final String query, final int limit) {
        return searchHybrid(query, limit, HybridRetrieverService.DEFAULT_VECTOR_WEIGHT,
                HybridRetrieverService.DEFAULT_KEYWORD_WEIGHT);
    }

    public List<SearchResult> searchHybrid(final String query,
                                           final int limit,
                                           final double vectorWeight,
                                           final double keywordWeight) {
        requireLimit(limit);
        return hybridRetriever.search(query, limit, vectorWeight, keywordWeight);
    }

    public boolean documentExists(final String ticker) {
        return vectorIndex.countByTicker(ticker) > 0;
    }

    public long deleteByTicker(final String ticker) {
        return vectorIndex.deleteByTicker(ticker);
    }

    public CollectionInfo collectionInfo() {
        return new CollectionInfo(vectorIndex.count(), embeddingService.modelName(), chunkSize, chunkOverlap);
    }

    private ReportDocumentEntity requireEmbeddable(final String ticker) {
        final ReportDocumentEntity report = catalogService.findByTicker(ticker)
                .orElseThrow(() -> new EmbeddingPreconditionException(ticker, "No report stored for ticker " + ticker));

        if (report.getSuccessFlag() != ESuccessFlag.COMPLETE) {
            throw new EmbeddingPreconditionException(ticker, "Report of " + ticker + " is " + report.getSuccessFlag()
                    + " (" + report.getSuccessfulPages() + "/" + report.getTotalPages() + " pages), only COMPLETE reports are embedded");
        }

        if (StringUtils.isBlank(report.getParsedContent())) {
            throw new EmbeddingPreconditionException(ticker, "Report of " + ticker + " has no content");
        }
        return report;
    }

    private void requireLimit(final int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
