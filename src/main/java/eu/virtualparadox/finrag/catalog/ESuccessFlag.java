package eu.virtualparadox.finrag.catalog;

/**
 * Outcome of the page fan-out for one report, derived from its page counts.
 */
public enum ESuccessFlag {
    COMPLETE,
    PARTIAL,
    FAILED;

    /**
     * @param totalPages      pages extracted from the PDF
     * @param successfulPages pages that came back from the completion call
     * @return {@link #COMPLETE} when every page succeeded, {@link #FAILED} when none did, else {@link #PARTIAL}
     */
    public static ESuccessFlag of(final int totalPages, final int successfulPages) {
        if (successfulPages <= 0) {
            return FAILED;
        }
        return successfulPages == totalPages ? COMPLETE : PARTIAL;
    }
}
