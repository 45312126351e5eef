package eu.virtualparadox.finrag.rag.pipeline;

public record DocumentInfo(String documentId, String filename, int totalPages, int successfulPages) {
}
