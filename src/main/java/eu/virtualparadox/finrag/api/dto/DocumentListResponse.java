package eu.virtualparadox.finrag.api.dto;

import java.util.List;

public record DocumentListResponse(List<ReportDocumentResponse> documents, long total, int skip, int limit) {
}
