package eu.virtualparadox.finrag.exception;

import lombok.Getter;

@Getter
public class VectorStoreException extends RuntimeException {

    private final String operation;

    public VectorStoreException(final String operation, final Throwable cause) {
        super("Vector index operation '" + operation + "' failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }
}
