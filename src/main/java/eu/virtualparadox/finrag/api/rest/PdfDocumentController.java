package eu.virtualparadox.finrag.api.rest;

import eu.virtualparadox.finrag.api.dto.BaseResponse;
import eu.virtualparadox.finrag.api.dto.DocumentListResponse;
import eu.virtualparadox.finrag.api.dto.ReportDocumentResponse;
import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.model.DuplicateCleanupResult;
import eu.virtualparadox.finrag.catalog.service.DocumentCatalogService;
import eu.virtualparadox.finrag.exception.DocumentNotFoundException;
import eu.virtualparadox.finrag.ingest.lifecycle.ProcessingOutcome;
import eu.virtualparadox.finrag.ingest.lifecycle.ReportProcessingService;
import eu.virtualparadox.finrag.ingest.prompt.PromptCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/** Catalog management of stored reports. */
@RestController
@RequestMapping("/pdf")
@Slf4j
@RequiredArgsConstructor
public class PdfDocumentController {

    private final DocumentCatalogService catalogService;
    private final ReportProcessingService processingService;
    private final ApplicationConfig config;

    @GetMapping("/documents")
    public ResponseEntity<BaseResponse<DocumentListResponse>> list(
            @RequestParam(defaultValue = "0") final int skip,
            @RequestParam(defaultValue = "10") final int limit,
            @RequestParam(required = false) final EDocumentStatus status) {
        final List<ReportDocumentResponse> documents = catalogService.list(skip, limit, status).stream()
                .map(ReportDocumentResponse::fromEntity)
                .toList();
        final long total = catalogService.count(status);
        return ResponseEntity.ok(BaseResponse.ok("Found " + documents.size() + " of " + total + " document(s)",
                new DocumentListResponse(documents, total, skip, limit)));
    }

    @GetMapping("/documents/{id}")
    public ResponseEntity<BaseResponse<ReportDocumentResponse>> get(@PathVariable final String id) {
        final ReportDocumentResponse document = catalogService.findById(id)
                .map(ReportDocumentResponse::fromEntity)
                .orElseThrow(() -> new DocumentNotFoundException(id));
        return ResponseEntity.ok(BaseResponse.ok("Document found", document));
    }

    /** Newest report of a ticker. */
    @GetMapping("/documents/stock/{ticker}")
    public ResponseEntity<BaseResponse<ReportDocumentResponse>> getByTicker(@PathVariable final String ticker) {
        final ReportDocumentResponse document = catalogService.findByTicker(ticker)
                .map(ReportDocumentResponse::fromEntity)
                .orElseThrow(() -> new DocumentNotFoundException(ticker));
        return ResponseEntity.ok(BaseResponse.ok("Document found", document));
    }

    @PutMapping("/documents/{id}/status")
    public ResponseEntity<BaseResponse<Void>> updateStatus(@PathVariable final String id,
                                                           @RequestParam final EDocumentStatus status) {
        if (!catalogService.updateStatus(id, status)) {
            throw new DocumentNotFoundException(id);
        }
        return ResponseEntity.ok(BaseResponse.ok("Status of " + id + " set to " + status, null));
    }

    @DeleteMapping("/documents/{id}")
    public ResponseEntity<BaseResponse<Void>> delete(@PathVariable final String id) {
        if (!catalogService.delete(id)) {
            throw new DocumentNotFoundException(id);
        }
        return ResponseEntity.ok(BaseResponse.ok("Document " + id + " deleted", null));
    }

    @PostMapping("/cleanup-duplicates")
    public ResponseEntity<BaseResponse<DuplicateCleanupResult>> cleanupDuplicates() {
        final DuplicateCleanupResult result = catalogService.cleanupDuplicates();
        return ResponseEntity.ok(BaseResponse.ok("Removed " + result.totalRemoved() + " duplicate document(s)", result));
    }

    /** Parses an uploaded PDF and stores it as the report of a ticker. */
    @PostMapping("/upload/{ticker}")
    public ResponseEntity<BaseResponse<ProcessingOutcome>> upload(
            @PathVariable final String ticker,
            @RequestParam("file") final MultipartFile file,
            @RequestParam(defaultValue = PromptCatalog.DEFAULT_TYPE) final String promptType,
            @RequestParam(required = false) final String customPrompt) throws IOException {
        Files.createDirectories(config.getDownloads());
        final Path temp = Files.createTempFile(config.getDownloads(), "up-", ".pdf");
        try {
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            final ProcessingOutcome outcome = processingService.processUpload(ticker, temp,
                    file.getOriginalFilename(), promptType, customPrompt);
            return ResponseEntity.ok(BaseResponse.ok("Uploaded report of " + ticker + " processed and stored", outcome));
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
