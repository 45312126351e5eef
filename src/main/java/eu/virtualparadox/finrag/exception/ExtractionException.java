package eu.virtualparadox.finrag.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when a PDF cannot be opened or read. Aborts the whole processing run.
 */
@Getter
public class ExtractionException extends RuntimeException {

    private final Path path;

    public ExtractionException(final Path path, final Throwable cause) {
        super("Failed to extract text from PDF: " + path, cause);
        this.path = path;
    }
}
