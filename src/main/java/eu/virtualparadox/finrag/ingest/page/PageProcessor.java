package eu.virtualparadox.finrag.ingest.page;

import eu.virtualparadox.finrag.ingest.extractor.RawPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Sends one page to the completion model and parses the answer.
 * <p>Never throws: any error while calling the model or reading its answer becomes a {@link PageFailure}
 * so that sibling pages are unaffected.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageProcessor {

    private final CompletionClient completionClient;
    private final ResponseParser responseParser;
    private final Clock clock;

    public PageOutcome process(final RawPage page, final String prompt) {
        try {
            final String userContent = "Page " + page.pageNumber() + " content:\n\n" + page.text();
            final String response = completionClient.complete(prompt, userContent);
            final ParsedContent parsed = responseParser.parse(response);

            log.debug("Page {} parsed as {}", page.pageNumber(), parsed.getClass().getSimpleName());
            return new PageResult(page.pageNumber(), page.charCount(), page.wordCount(), parsed, clock.instant());
        } catch (Exception e) {
            final String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Page {} failed: {}", page.pageNumber(), error);
            return new PageFailure(page.pageNumber(), error);
        }
    }
}
