package eu.virtualparadox.finrag.ingest.fanout;

import eu.virtualparadox.finrag.application.executor.PageExecutor;
import eu.virtualparadox.finrag.ingest.extractor.RawPage;
import eu.virtualparadox.finrag.ingest.page.PageFailure;
import eu.virtualparadox.finrag.ingest.page.PageOutcome;
import eu.virtualparadox.finrag.ingest.page.PageProcessor;
import eu.virtualparadox.finrag.ingest.page.PageResult;
import eu.virtualparadox.finrag.ingest.page.ParsedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@link PageProcessor} for every page of a document on the bounded {@link PageExecutor}.
 * <p>
 * All pages are submitted at once and the coordinator waits until each one has settled. A failing or
 * slow page never cancels its siblings: it is recorded as a {@link PageFailure}. The per-page timeout
 * starts when a worker picks the page up, so pages waiting in the queue are not penalised.
 * </p>
 */
@Service
@Slf4j
public class FanOutCoordinator {

    private static final String FIELD_KEYWORDS = "keywords";
    private static final String FIELD_SUMMARY = "summary";
    private static final String FIELD_CATEGORY = "category";

    private final PageProcessor pageProcessor;
    private final PageExecutor pageExecutor;
    private final Duration pageTimeout;

    public FanOutCoordinator(final PageProcessor pageProcessor,
                             final PageExecutor pageExecutor,
                             @Value("${finrag.pipeline.page-timeout:PT120S}") final Duration pageTimeout) {
        this.pageProcessor = pageProcessor;
        this.pageExecutor = pageExecutor;
        this.pageTimeout = pageTimeout;
    }

    public ProcessingResult run(final List<RawPage> pages, final String prompt) {
        log.info("Processing {} page(s), timeout {} per page", pages.size(), pageTimeout);

        final List<CompletableFuture<PageOutcome>> futures = pages.stream()
                .map(page -> submit(page, prompt))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        final List<PageResult> results = new ArrayList<>();
        final List<PageFailure> failures = new ArrayList<>();
        for (final CompletableFuture<PageOutcome> future : futures) {
            final PageOutcome outcome = future.join();
            if (outcome instanceof PageResult result) {
                results.add(result);
            } else if (outcome instanceof PageFailure failure) {
                failures.add(failure);
            }
        }

        results.sort(Comparator.comparingInt(PageResult::pageNumber));
        failures.sort(Comparator.comparingInt(PageFailure::pageNumber));

        final List<Integer> failedPages = failures.stream().map(PageFailure::pageNumber).toList();
        if (!failedPages.isEmpty()) {
            log.warn("{} of {} page(s) failed: {}", failedPages.size(), pages.size(), failedPages);
        }
        log.info("Fan-out finished: {}/{} page(s) succeeded", results.size(), pages.size());

        return new ProcessingResult(pages.size(), results.size(), failedPages, failures, results, integrate(results));
    }

    /**
     * Folds the optional per-page fields of successful results into one {@link IntegratedSummary}.
     */
    IntegratedSummary integrate(final List<PageResult> results) {
        if (results.isEmpty()) {
            return IntegratedSummary.empty("No pages were processed successfully");
        }

        final Set<String> keywords = new LinkedHashSet<>();
        final Set<String> categories = new LinkedHashSet<>();
        final List<PageSummary> summaries = new ArrayList<>();

        for (final PageResult result : results) {
            if (result.parsedContent() instanceof ParsedContent.Structured structured) {
                keywords.addAll(structured.textList(FIELD_KEYWORDS));
                structured.text(FIELD_SUMMARY).ifPresent(s -> summaries.add(new PageSummary(result.pageNumber(), s)));
                structured.text(FIELD_CATEGORY).ifPresent(categories::add);
            }
        }

        final String combined = String.join(" ", summaries.stream().map(PageSummary::summary).toList());
        return new IntegratedSummary(results.size(), List.copyOf(keywords), combined,
                List.copyOf(summaries), List.copyOf(categories), null);
    }

    private CompletableFuture<PageOutcome> submit(final RawPage page, final String prompt) {
        final CompletableFuture<PageOutcome> future = new CompletableFuture<>();
        pageExecutor.execute(() -> {
            future.orTimeout(pageTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                future.complete(pageProcessor.process(page, prompt));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future.exceptionally(ex -> toFailure(page, ex));
    }

    private PageOutcome toFailure(final RawPage page, final Throwable ex) {
        final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        final String error = cause instanceof TimeoutException
                ? "Page processing timed out after " + pageTimeout
                : String.valueOf(cause.getMessage());
        log.warn("Page {} failed: {}", page.pageNumber(), error);
        return new PageFailure(page.pageNumber(), error);
    }
}
