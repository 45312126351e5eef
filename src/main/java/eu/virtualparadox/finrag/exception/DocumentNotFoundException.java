package eu.virtualparadox.finrag.exception;

import lombok.Getter;

/** Thrown by the HTTP layer when a report id or ticker is unknown. */
@Getter
public class DocumentNotFoundException extends RuntimeException {

    private final String key;

    public DocumentNotFoundException(final String key) {
        super("Document not found: " + key);
        this.key = key;
    }
}
