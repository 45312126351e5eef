package eu.virtualparadox.finrag.api.rest;

import eu.virtualparadox.finrag.api.dto.BaseResponse;
import eu.virtualparadox.finrag.api.dto.DocumentListResponse;
import eu.virtualparadox.finrag.api.dto.ReportDocumentResponse;
import eu.virtualparadox.finrag.catalog.service.DocumentCatalogService;
import eu.virtualparadox.finrag.ingest.lifecycle.ProcessingOutcome;
import eu.virtualparadox.finrag.ingest.lifecycle.ReportProcessingService;
import eu.virtualparadox.finrag.ingest.prompt.PromptCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Ticker driven report processing. */
@RestController
@RequestMapping("/stock")
@RequiredArgsConstructor
public class StockController {

    private final ReportProcessingService processingService;
    private final DocumentCatalogService catalogService;

    /** Downloads, parses and stores the report of a ticker. */
    @PostMapping("/process/{ticker}")
    public ResponseEntity<BaseResponse<ProcessingOutcome>> process(
            @PathVariable final String ticker,
            @RequestParam(defaultValue = PromptCatalog.DEFAULT_TYPE) final String promptType,
            @RequestParam(required = false) final String customPrompt) {
        final ProcessingOutcome outcome = processingService.processTicker(ticker, promptType, customPrompt);
        return ResponseEntity.ok(BaseResponse.ok("Report of " + ticker + " processed and stored", outcome));
    }

    /** Lists the stored reports of a ticker, newest first. */
    @GetMapping("/documents/{ticker}")
    public ResponseEntity<BaseResponse<DocumentListResponse>> documents(
            @PathVariable final String ticker,
            @RequestParam(defaultValue = "0") final int skip,
            @RequestParam(defaultValue = "10") final int limit) {
        final List<ReportDocumentResponse> documents = catalogService.listByTicker(ticker, skip, limit).stream()
                .map(ReportDocumentResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(BaseResponse.ok("Found " + documents.size() + " document(s)",
                new DocumentListResponse(documents, documents.size(), skip, limit)));
    }
}
