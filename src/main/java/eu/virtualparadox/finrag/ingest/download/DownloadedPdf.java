package eu.virtualparadox.finrag.ingest.download;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A PDF fetched to local disk. The caller owns {@code path} and deletes it when done.
 */
public record DownloadedPdf(Path path,
                            String filename,
                            String sourceUrl,
                            long fileSize,
                            String contentType,
                            Instant downloadTime) {
}
