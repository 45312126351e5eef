package eu.virtualparadox.finrag.api.rest;

import eu.virtualparadox.finrag.api.dto.BaseResponse;
import eu.virtualparadox.finrag.api.dto.SearchRequest;
import eu.virtualparadox.finrag.api.dto.SearchResponse;
import eu.virtualparadox.finrag.rag.pipeline.CollectionInfo;
import eu.virtualparadox.finrag.rag.pipeline.EmbeddingPipelineService;
import eu.virtualparadox.finrag.rag.pipeline.EmbeddingResult;
import eu.virtualparadox.finrag.rag.retriever.service.HybridRetrieverService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Chunk embedding and search over the vector index. */
@RestController
@RequestMapping("/embedding")
@RequiredArgsConstructor
public class EmbeddingController {

    private final EmbeddingPipelineService pipeline;

    @PostMapping("/store/{ticker}")
    public ResponseEntity<BaseResponse<EmbeddingResult>> store(@PathVariable final String ticker) {
        final EmbeddingResult result = pipeline.embedAndStore(ticker);
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(BaseResponse.fail(result.message(), result));
        }
        return ResponseEntity.ok(BaseResponse.ok(result.message(), result));
    }

    @PostMapping("/search")
    public ResponseEntity<BaseResponse<SearchResponse>> search(@RequestBody final SearchRequest request) {
        final SearchResponse response = SearchResponse.of(request.query(), "vector",
                pipeline.searchVector(request.query(), request.limitOrDefault()));
        return ResponseEntity.ok(BaseResponse.ok("Found " + response.count() + " result(s)", response));
    }

    @PostMapping("/search/keyword")
    public ResponseEntity<BaseResponse<SearchResponse>> searchKeyword(@RequestBody final SearchRequest request) {
        final SearchResponse response = SearchResponse.of(request.query(), "keyword",
                pipeline.searchKeyword(request.query(), request.limitOrDefault()));
        return ResponseEntity.ok(BaseResponse.ok("Found " + response.count() + " result(s)", response));
    }

    @PostMapping("/search/hybrid")
    public ResponseEntity<BaseResponse<SearchResponse>> searchHybrid(@RequestBody final SearchRequest request) {
        final double vectorWeight = request.vectorWeight() == null
                ? HybridRetrieverService.DEFAULT_VECTOR_WEIGHT : request.vectorWeight();
        final double keywordWeight = request.keywordWeight() == null
                ? HybridRetrieverService.DEFAULT_KEYWORD_WEIGHT : request.keywordWeight();

        final SearchResponse response = SearchResponse.of(request.query(), "hybrid",
                pipeline.searchHybrid(request.query(), request.limitOrDefault(), vectorWeight, keywordWeight));
        return ResponseEntity.ok(BaseResponse.ok("Found " + response.count() + " result(s)", response));
    }

    @GetMapping("/exists/{ticker}")
    public ResponseEntity<BaseResponse<Map<String, Object>>> exists(@PathVariable final String ticker) {
        final boolean exists = pipeline.documentExists(ticker);
        return ResponseEntity.ok(BaseResponse.ok(exists ? "Chunks exist" : "No chunks",
                Map.of("ticker", ticker, "exists", exists)));
    }

    @DeleteMapping("/{ticker}")
    public ResponseEntity<BaseResponse<Map<String, Object>>> delete(@PathVariable final String ticker) {
        final long deleted = pipeline.deleteByTicker(ticker);
        return ResponseEntity.ok(BaseResponse.ok("Deleted " + deleted + " chunk(s)",
                Map.of("ticker", ticker, "deletedCount", deleted)));
    }

    @GetMapping("/collection/info")
    public ResponseEntity<BaseResponse<CollectionInfo>> collectionInfo() {
        return ResponseEntity.ok(BaseResponse.ok("Collection info", pipeline.collectionInfo()));
    }
}
