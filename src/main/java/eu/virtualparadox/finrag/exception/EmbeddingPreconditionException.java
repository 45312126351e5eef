package eu.virtualparadox.finrag.exception;

import lombok.Getter;

/**
 * Raised when a ticker's report is not in a state that may be embedded.
 */
@Getter
public class EmbeddingPreconditionException extends RuntimeException {

    private final String ticker;

    public EmbeddingPreconditionException(final String ticker, final String message) {
        super(message);
        this.ticker = ticker;
    }
}
