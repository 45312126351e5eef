package eu.virtualparadox.finrag.exception;

import lombok.Getter;

/**
 * Wraps a failure of the report catalog, naming the operation and the ticker or id it was running for.
 */
@Getter
public class DocumentStoreException extends RuntimeException {

    private final String operation;
    private final String key;

    public DocumentStoreException(final String operation, final String key, final Throwable cause) {
        super("Document store operation '" + operation + "' failed for " + key + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.key = key;
    }
}
