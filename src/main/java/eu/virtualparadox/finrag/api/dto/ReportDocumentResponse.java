package eu.virtualparadox.finrag.api.dto;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.entity.ReportDocumentEntity;

import java.time.Instant;
import java.util.List;

public record ReportDocumentResponse(String id,
                                     String ticker,
                                     String filename,
                                     String sourceUrl,
                                     long fileSize,
                                     String contentType,
                                     Instant downloadTime,
                                     String promptType,
                                     String parsedContent,
                                     String summary,
                                     int totalPages,
                                     int successfulPages,
                                     List<Integer> failedPages,
                                     EDocumentStatus status,
                                     ESuccessFlag successFlag,
                                     Instant createdAt,
                                     Instant updatedAt) {

    public static ReportDocumentResponse fromEntity(final ReportDocumentEntity e) {
        return new ReportDocumentResponse(e.getId(), e.getTicker(), e.getFilename(), e.getSourceUrl(),
                e.getFileSize(), e.getContentType(), e.getDownloadTime(), e.getPromptType(), e.getParsedContent(),
                e.getSummary(), e.getTotalPages(), e.getSuccessfulPages(),
                e.getFailedPages() == null ? List.of() : List.copyOf(e.getFailedPages()),
                e.getStatus(), e.getSuccessFlag(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
