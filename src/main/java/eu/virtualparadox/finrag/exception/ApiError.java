package eu.virtualparadox.finrag.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

    public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
    public static final String EXTRACTION_FAILED = "DOCUMENT_002";
    public static final String DOWNLOAD_FAILED = "DOCUMENT_003";
    public static final String DOCUMENT_STORE_ERROR = "STORE_001";
    public static final String VECTOR_STORE_ERROR = "STORE_002";
    public static final String VALIDATION_ERROR = "VALIDATION_001";
    public static final String INTERNAL_ERROR = "INTERNAL_001";

    /** Short id for correlating the response with the log line. */
    private final String errorId;

    private final String code;

    private final String message;

    private final Instant timestamp;

    private final String path;
}
