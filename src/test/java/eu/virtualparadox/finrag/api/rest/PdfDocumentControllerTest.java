package eu.virtualparadox.finrag.api.rest;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.entity.ReportDocumentEntity;
import eu.virtualparadox.finrag.catalog.model.DuplicateCleanupResult;
import eu.virtualparadox.finrag.catalog.service.DocumentCatalogService;
import eu.virtualparadox.finrag.exception.ApiError;
import eu.virtualparadox.finrag.exception.DocumentStoreException;
import eu.virtualparadox.finrag.exception.GlobalExceptionHandler;
import eu.virtualparadox.finrag.ingest.fanout.IntegratedSummary;
import eu.virtualparadox.finrag.ingest.lifecycle.ProcessingOutcome;
import eu.virtualparadox.finrag.ingest.lifecycle.ReportProcessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PdfDocumentControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @TempDir
    Path downloads;

    private DocumentCatalogService catalog;
    private ReportProcessingService processing;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        catalog = mock(DocumentCatalogService.class);
        processing = mock(ReportProcessingService.class);
        final ApplicationConfig config = new ApplicationConfig();
        config.setDownloads(downloads);
        mvc = MockMvcBuilders.standaloneSetup(new PdfDocumentController(catalog, processing, config))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ReportDocumentEntity document(final String id, final String ticker) {
        return ReportDocumentEntity.builder()
                .id(id)
                .ticker(ticker)
                .filename(ticker + ".pdf")
                .parsedContent("## Page 1\n\nbody\n\n")
                .totalPages(1)
                .successfulPages(1)
                .status(EDocumentStatus.COMPLETED)
                .successFlag(ESuccessFlag.COMPLETE)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("An unknown id gives a 404 error body")
    void get_notFound() throws Exception {
        when(catalog.findById("nope")).thenReturn(Optional.empty());

        mvc.perform(get("/pdf/documents/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_NOT_FOUND))
                .andExpect(jsonPath("$.path").value("/pdf/documents/nope"))
                .andExpect(jsonPath("$.errorId").isNotEmpty());
    }

    @Test
    @DisplayName("A stored document is returned in the response envelope")
    void get_found() throws Exception {
        when(catalog.findById("doc-1")).thenReturn(Optional.of(document("doc-1", "SPY")));

        mvc.perform(get("/pdf/documents/doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.ticker").value("SPY"))
                .andExpect(jsonPath("$.data.successFlag").value("COMPLETE"));
    }

    @Test
    @DisplayName("Listing passes paging and status through and reports the total")
    void list() throws Exception {
        when(catalog.list(5, 2, EDocumentStatus.COMPLETED)).thenReturn(List.of(document("a", "A"), document("b", "B")));
        when(catalog.count(EDocumentStatus.COMPLETED)).thenReturn(12L);

        mvc.perform(get("/pdf/documents").param("skip", "5").param("limit", "2").param("status", "COMPLETED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.documents.length()").value(2))
                .andExpect(jsonPath("$.data.total").value(12))
                .andExpect(jsonPath("$.data.skip").value(5));
    }

    @Test
    @DisplayName("An unknown status value is a 400")
    void list_badStatus() throws Exception {
        mvc.perform(get("/pdf/documents").param("status", "DONE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("Status update and delete of unknown ids are 404")
    void updateAndDelete_unknown() throws Exception {
        when(catalog.updateStatus("x", EDocumentStatus.FAILED)).thenReturn(false);
        when(catalog.delete("x")).thenReturn(false);

        mvc.perform(put("/pdf/documents/x/status").param("status", "FAILED")).andExpect(status().isNotFound());
        mvc.perform(delete("/pdf/documents/x")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Duplicate cleanup reports its counts")
    void cleanupDuplicates() throws Exception {
        when(catalog.cleanupDuplicates()).thenReturn(new DuplicateCleanupResult(1, 2));

        mvc.perform(post("/pdf/cleanup-duplicates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.duplicateTickerCount").value(1))
                .andExpect(jsonPath("$.data.totalRemoved").value(2));
    }

    @Test
    @DisplayName("A store failure is a 503")
    void storeFailure() throws Exception {
        when(catalog.findByTicker("SPY")).thenThrow(new DocumentStoreException("findByTicker", "SPY",
                new DataAccessResourceFailureException("down")));

        mvc.perform(get("/pdf/documents/stock/SPY"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_STORE_ERROR));
    }

    @Test
    @DisplayName("An uploaded PDF is processed under its own name from a temporary file that is removed afterwards")
    void upload() throws Exception {
        when(processing.processUpload(eq("SPY"), any(Path.class), eq("report.pdf"), eq("financial"), isNull())).thenReturn(
                new ProcessingOutcome("SPY", "doc-1", null, "report.pdf", 4, 1, 1, List.of(),
                        ESuccessFlag.COMPLETE, IntegratedSummary.empty(null), NOW));

        mvc.perform(multipart("/pdf/upload/SPY")
                        .file(new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[]{1, 2, 3, 4}))
                        .param("promptType", "financial"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.documentId").value("doc-1"));

        verify(processing).processFile(eq("SPY"), any(Path.class), eq("financial"), isNull());
        try (Stream<Path> left = Files.list(downloads)) {
            assertThat(left).isEmpty();
        }
    }
}
