package eu.virtualparadox.finrag.rag.retriever.service;

import eu.virtualparadox.finrag.rag.retriever.model.SearchResult;

import java.util.List;

public interface RetrieverService {

    List<SearchResult> search(final String query, final int k);

}
