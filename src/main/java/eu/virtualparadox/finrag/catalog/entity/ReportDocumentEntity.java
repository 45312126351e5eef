package eu.virtualparadox.finrag.catalog.entity;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.converter.PageListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical parsed report of one ticker. The ticker is the business key; the table carries no unique
 * constraint on it so that rows written before deduplication can still be cleaned up.
 */
@Entity
@Table(name = "report_documents", indexes = @Index(name = "idx_report_ticker", columnList = "ticker"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportDocumentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(length = 32, nullable = false)
    private String ticker;

    @Column(length = 512)
    private String filename;

    @Column(name = "source_url", length = 2048)
    private String sourceUrl;

    @Column(name = "file_size")
    private long fileSize;

    @Column(name = "content_type", length = 128)
    private String contentType;

    @Column(name = "download_time")
    private Instant downloadTime;

    @Column(name = "prompt_type", length = 64)
    private String promptType;

    @Lob
    @Column(name = "parsed_content")
    private String parsedContent;

    @Lob
    @Column(name = "summary")
    private String summary;

    @Column(name = "total_pages", nullable = false)
    private int totalPages;

    @Column(name = "successful_pages", nullable = false)
    private int successfulPages;

    @Lob
    @Column(name = "failed_pages")
    @Convert(converter = PageListConverter.class)
    @Builder.Default
    private List<Integer> failedPages = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private EDocumentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "success_flag", length = 16, nullable = false)
    private ESuccessFlag successFlag;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }

        if (updatedAt == null) {
            updatedAt = createdAt;
        }

        if (status == null) {
            status = EDocumentStatus.PENDING;
        }

        if (successFlag == null) {
            successFlag = ESuccessFlag.of(totalPages, successfulPages);
        }
    }
}
