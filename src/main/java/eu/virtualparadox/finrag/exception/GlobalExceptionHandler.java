package eu.virtualparadox.finrag.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps domain exceptions raised below the controllers to HTTP status codes and an {@link ApiError} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(final DocumentNotFoundException ex,
                                                   final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.warn("Document not found [{}]: {}", errorId, ex.getKey());
        return build(HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ApiError> handleExtraction(final ExtractionException ex,
                                                     final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.error("PDF extraction failed [{}]: {}", errorId, ex.getPath(), ex);
        return build(HttpStatus.UNPROCESSABLE_ENTITY, errorId, ApiError.EXTRACTION_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(PdfDownloadException.class)
    public ResponseEntity<ApiError> handleDownload(final PdfDownloadException ex,
                                                   final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.error("PDF download failed [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, errorId, ApiError.DOWNLOAD_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(DocumentStoreException.class)
    public ResponseEntity<ApiError> handleDocumentStore(final DocumentStoreException ex,
                                                        final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.error("Document store error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.DOCUMENT_STORE_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(VectorStoreException.class)
    public ResponseEntity<ApiError> handleVectorStore(final VectorStoreException ex,
                                                      final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.error("Vector index error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.VECTOR_STORE_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleValidation(final Exception ex, final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.warn("Validation error [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(final Exception ex, final HttpServletRequest request) {
        final String errorId = generateErrorId();
        log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> build(final HttpStatus status,
                                           final String errorId,
                                           final String code,
                                           final String message,
                                           final HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code(code)
                        .message(message)
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
