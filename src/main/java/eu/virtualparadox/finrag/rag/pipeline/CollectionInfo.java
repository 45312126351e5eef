package eu.virtualparadox.finrag.rag.pipeline;

public record CollectionInfo(long totalChunks, String embeddingModel, int chunkSize, int chunkOverlap) {
}
