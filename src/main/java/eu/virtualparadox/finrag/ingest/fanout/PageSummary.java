package eu.virtualparadox.finrag.ingest.fanout;

public record PageSummary(int page, String summary) {
}
