package eu.virtualparadox.finrag.api.dto;

import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;

import java.util.List;

public record SearchResponse(String query, String searchType, int count, List<SearchResult> results) {

    public static SearchResponse of(final String query, final String searchType, final List<SearchResult> results) {
        return new SearchResponse(query, searchType, results.size(), results);
    }
}
