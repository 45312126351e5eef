package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HybridRetrieverServiceTest {

    private KnnRetrieverService knn;
    private KeywordRetrieverService keyword;
    private HybridRetrieverService hybrid;

    @BeforeEach
    void setUp() {
        knn = mock(KnnRetrieverService.class);
        keyword = mock(KeywordRetrieverService.class);
        hybrid = new HybridRetrieverService(knn, keyword);
    }

    private static SearchResult hit(final String chunkId, final double score) {
        return new SearchResult(chunkId, "T", 1, "text " + chunkId, "d", "t.pdf", score);
    }

    @Test
    @DisplayName("Scores of a chunk found by both searches are weighted and summed")
    void search_fusesSharedChunks() {
        when(knn.search("q", 4)).thenReturn(List.of(hit("T_0001", 0.8), hit("T_0002", 0.9)));
        when(keyword.search("q", 4)).thenReturn(List.of(hit("T_0001", 1.0)));

        final List<SearchResult> results = hybrid.search("q", 2, 0.7, 0.3);

        assertThat(results).extracting(SearchResult::chunkId).containsExactly("T_0001", "T_0002");
        assertThat(results.get(0).score()).isCloseTo(0.86, within(1e-9));
        assertThat(results.get(1).score()).isCloseTo(0.63, within(1e-9));
        verify(knn).search("q", 4);
        verify(keyword).search("q", 4);
    }

    @Test
    @DisplayName("Results are truncated to the limit after fusion")
    void search_truncates() {
        when(knn.search("q", 2)).thenReturn(List.of(hit("A", 0.5), hit("B", 0.4)));
        when(keyword.search("q", 2)).thenReturn(List.of(hit("C", 1.0)));

        assertThat(hybrid.search("q", 1, 0.7, 0.3)).extracting(SearchResult::chunkId).containsExactly("A");
    }

    @Test
    @DisplayName("Equal scores are ordered by chunk id")
    void search_tieBreak() {
        when(knn.search("q", 4)).thenReturn(List.of(hit("B", 1.0), hit("A", 1.0)));
        when(keyword.search("q", 4)).thenReturn(List.of());

        assertThat(hybrid.search("q", 2, 0.5, 0.5)).extracting(SearchResult::chunkId).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Oversampling a very large limit does not overflow")
    void search_largeLimitOversampling() {
        when(knn.search("q", Integer.MAX_VALUE - 1)).thenReturn(List.of(hit("A", 0.5)));
        when(keyword.search("q", Integer.MAX_VALUE - 1)).thenReturn(List.of());

        assertThat(hybrid.search("q", Integer.MAX_VALUE, 0.7, 0.3)).extracting(SearchResult::chunkId).containsExactly("A");
        verify(knn).search("q", Integer.MAX_VALUE - 1);
        verify(keyword).search("q", Integer.MAX_VALUE - 1);
    }

    @Test
    @DisplayName("Weights outside [0, 1] are rejected without searching")
    void search_rejectsWeights() {
        assertThatThrownBy(() -> hybrid.search("q", 5, 1.5, 0.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hybrid.search("q", 5, 0.7, -0.1)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(knn, keyword);
    }
}
