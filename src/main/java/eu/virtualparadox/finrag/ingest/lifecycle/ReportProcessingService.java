package eu.virtualparadox.finrag.ingest.lifecycle;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.model.ReportDraft;
import eu.virtualparadox.finrag.catalog.service.DocumentCatalogService;
import eu.virtualparadox.finrag.exception.ExtractionException;
import eu.virtualparadox.finrag.ingest.download.DownloadedPdf;
import eu.virtualparadox.finrag.ingest.download.PdfDownloadService;
import eu.virtualparadox.finrag.ingest.extractor.PageExtractor;
import eu.virtualparadox.finrag.ingest.extractor.RawPage;
import eu.virtualparadox.finrag.ingest.fanout.FanOutCoordinator;
import eu.virtualparadox.finrag.ingest.fanout.ProcessingResult;
import eu.virtualparadox.finrag.ingest.merge.DocumentMerger;
import eu.virtualparadox.finrag.ingest.prompt.PromptCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Drives a report through extraction, page fan-out, merge and the ticker upsert.
 * <p>Extraction and download errors abort the run; page errors are recorded in the written report.
 * Embedding is a separate, explicit step.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportProcessingService {

    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private final PdfDownloadService downloadService;
    private final PageExtractor pageExtractor;
    private final FanOutCoordinator fanOutCoordinator;
    private final DocumentMerger documentMerger;
    private final DocumentCatalogService catalogService;
    private final PromptCatalog promptCatalog;
    private final Clock clock;

    /**
     * Downloads the report of a ticker and stores it with status {@link EDocumentStatus#COMPLETED}.
     */
    public ProcessingOutcome processTicker(final String ticker, final String promptType, final String customPrompt) {
        final String url = downloadService.reportUrl(ticker);
        log.info("Processing report of {} from {}", ticker, url);

        final DownloadedPdf pdf = downloadService.download(url, ticker);
        try {
            return run(ticker, pdf, promptType, customPrompt, EDocumentStatus.COMPLETED);
        } finally {
            downloadService.cleanup(pdf.path());
        }
    }

    /**
     * Processes a PDF already on disk and stores it with status {@link EDocumentStatus#PROCESSED}.
     * The file is left in place.
     */
    public ProcessingOutcome processFile(final String ticker,
                                         final Path path,
                                         final String promptType,
                                         final String customPrompt) {
        log.info("Processing local report {} for {}", path.getFileName(), ticker);
        final DownloadedPdf pdf = localPdf(path, path.getFileName().toString(), path.toUri().toString());
        return run(ticker, pdf, promptType, customPrompt, EDocumentStatus.PROCESSED);
    }

    /**
     * Processes an uploaded PDF staged at {@code path}. The report keeps the client's file name and has no
     * source URL, since the staged copy is removed by the caller.
     */
    public ProcessingOutcome processUpload(final String ticker,
                                           final Path path,
                                           final String originalFilename,
                                           final String promptType,
                                           final String customPrompt) {
        final String filename = StringUtils.defaultIfBlank(originalFilename, path.getFileName().toString());
        log.info("Processing uploaded report {} for {}", filename, ticker);
        return run(ticker, localPdf(path, filename, null), promptType, customPrompt, EDocumentStatus.PROCESSED);
    }

    private DownloadedPdf localPdf(final Path path, final String filename, final String sourceUrl) {
        return new DownloadedPdf(path, filename, sourceUrl, sizeOf(path), PDF_CONTENT_TYPE, clock.instant());
    }

    private ProcessingOutcome run(final String ticker,
                                  final DownloadedPdf pdf,
                                  final String promptType,
                                  final String customPrompt,
                                  final EDocumentStatus status) {
        final String prompt = promptCatalog.resolve(promptType, customPrompt);
        final String recordedType = StringUtils.isNotBlank(customPrompt)
                ? "custom"
                : StringUtils.defaultIfBlank(promptType, PromptCatalog.DEFAULT_TYPE);

        final List<RawPage> pages = pageExtractor.extract(pdf.path());
        final ProcessingResult result = fanOutCoordinator.run(pages, prompt);
        final String merged = documentMerger.merge(result.pageResults());

        final ReportDraft draft = ReportDraft.builder()
                .filename(pdf.filename())
                .sourceUrl(pdf.sourceUrl())
                .fileSize(pdf.fileSize())
                .contentType(pdf.contentType())
                .downloadTime(pdf.downloadTime())
                .promptType(recordedType)
                .parsedContent(merged)
                .summary(result.integratedSummary().combinedSummary())
                .totalPages(result.totalPages())
                .successfulPages(result.successfulPages())
                .failedPages(result.failedPages())
                .status(status)
                .build();

        final String documentId = catalogService.upsert(ticker, draft);
        final ESuccessFlag flag = ESuccessFlag.of(result.totalPages(), result.successfulPages());

        log.info("Report of {} stored as {} ({}/{} pages, {})",
                ticker, documentId, result.successfulPages(), result.totalPages(), flag);

        return new ProcessingOutcome(ticker, documentId, pdf.sourceUrl(), pdf.filename(), pdf.fileSize(),
                result.totalPages(), result.successfulPages(), result.failedPages(), flag,
                result.integratedSummary(), clock.instant());
    }

    private long sizeOf(final Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new ExtractionException(path, e);
        }
    }
}
