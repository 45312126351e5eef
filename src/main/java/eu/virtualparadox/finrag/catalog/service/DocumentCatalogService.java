package eu.virtualparadox.finrag.catalog.service;

import eu.virtualparadox.finrag.catalog.EDocumentStatus;
import eu.virtualparadox.finrag.catalog.ESuccessFlag;
import eu.virtualparadox.finrag.catalog.entity.ReportDocumentEntity;
import eu.virtualparadox.finrag.catalog.model.DuplicateCleanupResult;
import eu.virtualparadox.finrag.catalog.model.ReportDraft;
import eu.virtualparadox.finrag.catalog.repo.OffsetPageRequest;
import eu.virtualparadox.finrag.catalog.repo.ReportDocumentRepository;
import eu.virtualparadox.finrag.exception.DocumentStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Gateway to the report catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Keeping one report per ticker through {@link #upsert(String, ReportDraft)}</li>
 *     <li>Lookup, listing, status updates and deletion of catalog records</li>
 *     <li>Removing duplicate rows that predate the ticker-keyed upsert</li>
 * </ul>
 *
 * <p>Every call goes to the database; nothing is cached here. Vector chunks are linked to a report by
 * its ticker and are maintained separately by the embedding pipeline.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentCatalogService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final ReportDocumentRepository repository;
    private final Clock clock;

    /**
     * Writes the report of a ticker.
     *
     * <p>When the ticker already has a report, the newest one is overwritten in place: every field
     * changes except {@code id} and {@code createdAt}, and {@code updatedAt} moves to now. Otherwise a new
     * row is inserted with both timestamps set to now. The success flag is derived from the page counts.</p>
     *
     * @param ticker business key (non-blank)
     * @param draft  field values to write
     * @return id of the written report
     * @throws DocumentStoreException if the database call fails
     */
    @Transactional
    public String upsert(final String ticker, final ReportDraft draft) {
        requireTicker(ticker);
        return call("upsert", ticker, () -> {
            final Instant now = clock.instant();
            final Optional<ReportDocumentEntity> existing =
                    repository.findFirstByTickerOrderByUpdatedAtDescCreatedAtDescIdDesc(ticker);

            final ReportDocumentEntity entity = existing.orElseGet(() -> ReportDocumentEntity.builder()
                    .id(generateId())
                    .ticker(ticker)
                    .createdAt(now)
                    .build());

            apply(entity, draft);
            entity.setUpdatedAt(now);

            final ReportDocumentEntity saved = repository.save(entity);
            log.info("{} report for ticker {} (id={}, pages {}/{}, flag={})",
                    existing.isPresent() ? "Updated" : "Inserted",
                    ticker, saved.getId(), saved.getSuccessfulPages(), saved.getTotalPages(), saved.getSuccessFlag());
            return saved.getId();
        });
    }

    @Transactional(readOnly = true)
    public Optional<ReportDocumentEntity> findById(final String id) {
        return call("findById", id, () -> repository.findById(id));
    }

    /**
     * @return the newest report of the ticker, if any
     */
    @Transactional(readOnly = true)
    public Optional<ReportDocumentEntity> findByTicker(final String ticker) {
        return call("findByTicker", ticker,
                () -> repository.findFirstByTickerOrderByUpdatedAtDescCreatedAtDescIdDesc(ticker));
    }

    /**
     * Lists reports, newest first.
     *
     * @param skip   rows to skip
     * @param limit  maximum rows to return
     * @param status optional status filter, {@code null} for all
     */
    @Transactional(readOnly = true)
    public List<ReportDocumentEntity> list(final int skip, final int limit, final EDocumentStatus status) {
        final OffsetPageRequest page = new OffsetPageRequest(skip, limit, NEWEST_FIRST);
        return call("list", String.valueOf(status), () -> status == null
                ? repository.findAll(page).getContent()
                : repository.findByStatus(status, page));
    }

    @Transactional(readOnly = true)
    public List<ReportDocumentEntity> listByTicker(final String ticker, final int skip, final int limit) {
        final OffsetPageRequest page = new OffsetPageRequest(skip, limit, NEWEST_FIRST);
        return call("listByTicker", ticker, () -> repository.findByTicker(ticker, page));
    }

    @Transactional(readOnly = true)
    public long count(final EDocumentStatus status) {
        return call("count", String.valueOf(status),
                () -> status == null ? repository.count() : repository.countByStatus(status));
    }

    /**
     * @return {@code false} when no report has the given id
     */
    @Transactional
    public boolean updateStatus(final String id, final EDocumentStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return call("updateStatus", id, () -> repository.updateStatus(id, status, clock.instant()) > 0);
    }

    /**
     * @return {@code false} when no report has the given id
     */
    @Transactional
    public boolean delete(final String id) {
        return call("delete", id, () -> {
            if (!repository.existsById(id)) {
                return false;
            }
            repository.deleteById(id);
            return true;
        });
    }

    /**
     * Keeps only the most recently updated report of every ticker that has several.
     * <p>Equal {@code updatedAt} values are broken by the later {@code createdAt}, then by the greater id.</p>
     */
    @Transactional
    public DuplicateCleanupResult cleanupDuplicates() {
        return call("cleanupDuplicates", "*", () -> {
            final List<String> tickers = repository.findDuplicateTickers();
            int removed = 0;
            for (final String ticker : tickers) {
                final List<ReportDocumentEntity> reports =
                        repository.findByTickerOrderByUpdatedAtDescCreatedAtDescIdDesc(ticker);
                final List<ReportDocumentEntity> stale = new ArrayList<>(reports.subList(1, reports.size()));
                repository.deleteAll(stale);
                removed += stale.size();
                log.info("Ticker {}: kept report {}, removed {} duplicate(s)", ticker, reports.get(0).getId(), stale.size());
            }
            return new DuplicateCleanupResult(tickers.size(), removed);
        });
    }

    private void apply(final ReportDocumentEntity entity, final ReportDraft draft) {
        final List<Integer> failedPages = draft.failedPages() == null ? List.of() : draft.failedPages();

        entity.setFilename(draft.filename());
        entity.setSourceUrl(draft.sourceUrl());
        entity.setFileSize(draft.fileSize());
        entity.setContentType(draft.contentType());
        entity.setDownloadTime(draft.downloadTime());
        entity.setPromptType(draft.promptType());
        entity.setParsedContent(draft.parsedContent());
        entity.setSummary(draft.summary());
        entity.setTotalPages(draft.totalPages());
        entity.setSuccessfulPages(draft.successfulPages());
        entity.setFailedPages(new ArrayList<>(failedPages));
        entity.setStatus(draft.status() == null ? EDocumentStatus.PENDING : draft.status());
        entity.setSuccessFlag(ESuccessFlag.of(draft.totalPages(), draft.successfulPages()));
    }

    private <T> T call(final String operation, final String key, final Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new DocumentStoreException(operation, key, e);
        }
    }

    private void requireTicker(final String ticker) {
        if (StringUtils.isBlank(ticker)) {
            throw new IllegalArgumentException("ticker must not be blank");
        }
    }

    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
