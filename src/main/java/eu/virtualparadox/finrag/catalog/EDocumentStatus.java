package eu.virtualparadox.finrag.catalog;

public enum EDocumentStatus {
    PENDING,
    PROCESSING,
    /** Parsed from a local file. */
    PROCESSED,
    /** Downloaded and parsed by the ticker pipeline. */
    COMPLETED,
    FAILED
}
