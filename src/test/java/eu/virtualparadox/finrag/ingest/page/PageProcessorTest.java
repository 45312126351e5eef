package eu.virtualparadox.finrag.ingest.page;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.finrag.ingest.extractor.RawPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PageProcessorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private CompletionClient completionClient;
    private PageProcessor processor;

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        processor = new PageProcessor(completionClient, new ResponseParser(new ObjectMapper()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Sends the prompt as system message and the numbered page as user content")
    void process_success() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("{\"content\":\"ok\"}");

        final PageOutcome outcome = processor.process(RawPage.of(3, "Total return 4.5%"), "PROMPT");

        verify(completionClient).complete("PROMPT", "Page 3 content:\n\nTotal return 4.5%");
        assertThat(outcome).isInstanceOf(PageResult.class);
        final PageResult result = (PageResult) outcome;
        assertThat(result.pageNumber()).isEqualTo(3);
        assertThat(result.charCount()).isEqualTo(17);
        assertThat(result.wordCount()).isEqualTo(3);
        assertThat(result.processedAt()).isEqualTo(NOW);
        assertThat(result.parsedContent().contentText()).isEqualTo("ok");
    }

    @Test
    @DisplayName("A failing completion call becomes a page failure instead of an exception")
    void process_failureIsIsolated() {
        when(completionClient.complete(anyString(), anyString())).thenThrow(new IllegalStateException("rate limited"));

        final PageOutcome outcome = processor.process(RawPage.of(2, "text"), "PROMPT");

        assertThat(outcome).isEqualTo(new PageFailure(2, "rate limited"));
    }

    @Test
    @DisplayName("Empty pages are still sent and counted")
    void process_emptyPage() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("nothing on this page");

        final PageOutcome outcome = processor.process(RawPage.of(1, ""), "PROMPT");

        assertThat(outcome).isInstanceOf(PageResult.class);
        assertThat(((PageResult) outcome).wordCount()).isZero();
        assertThat(((PageResult) outcome).parsedContent()).isEqualTo(new ParsedContent.Raw("nothing on this page"));
    }
}
