package eu.virtualparadox.finrag.exception;

import lombok.Getter;

@Getter
public class PdfDownloadException extends RuntimeException {

    private final String url;

    public PdfDownloadException(final String url, final String message) {
        super(message + " (" + url + ")");
        this.url = url;
    }

    public PdfDownloadException(final String url, final String message, final Throwable cause) {
        super(message + " (" + url + ")", cause);
        this.url = url;
    }
}
