package eu.virtualparadox.finrag.ingest.extractor;

/**
 * Text of one PDF page as extracted, before any model call.
 *
 * @param pageNumber 1-based page number
 * @param text       page text, empty for image-only pages but never {@code null}
 * @param charCount  length of {@code text}
 * @param wordCount  whitespace separated tokens in {@code text}
 */
public record RawPage(int pageNumber, String text, int charCount, int wordCount) {

    public static RawPage of(final int pageNumber, final String text) {
        final String safe = text == null ? "" : text;
        final String trimmed = safe.strip();
        final int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        return new RawPage(pageNumber, safe, safe.length(), words);
    }
}
