package eu.virtualparadox.finrag.ingest.download;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.exception.PdfDownloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.OptionalLong;

/**
 * Fetches report PDFs over HTTP into the downloads folder.
 * <p>
 * A response is accepted only with status 200 and a {@code application/pdf} content type. A declared
 * {@code Content-Length} above the size limit is refused before reading, and the body is streamed to
 * disk and aborted as soon as it exceeds the limit.
 * </p>
 */
@Service
@Slf4j
public class PdfDownloadService {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String PDF_CONTENT_TYPE = "application/pdf";
    private static final int BUFFER_SIZE = 32 * 1024;

    private final HttpClient httpClient;
    private final ApplicationConfig config;
    private final Clock clock;
    private final String baseUrl;
    private final long maxBytes;
    private final Duration timeout;

    public PdfDownloadService(final ApplicationConfig config,
                              final Clock clock,
                              @Value("${finrag.download.base-url:}") final String baseUrl,
                              @Value("${finrag.download.max-size-mb:50}") final int maxSizeMb,
                              @Value("${finrag.download.timeout:PT60S}") final Duration timeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                config, clock, baseUrl, maxSizeMb, timeout);
    }

    PdfDownloadService(final HttpClient httpClient,
                       final ApplicationConfig config,
                       final Clock clock,
                       final String baseUrl,
                       final int maxSizeMb,
                       final Duration timeout) {
        this.httpClient = httpClient;
        this.config = config;
        this.clock = clock;
        this.baseUrl = baseUrl;
        this.maxBytes = (long) maxSizeMb * 1024 * 1024;
        this.timeout = timeout;
    }

    /**
     * @return the report URL of a ticker, the configured base URL followed by the ticker
     */
    public String reportUrl(final String ticker) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("finrag.download.base-url is not configured");
        }
        return baseUrl + ticker;
    }

    public DownloadedPdf download(final String url, final String ticker) {
        final Instant now = clock.instant();
        final String filename = ticker + "_" + FILE_STAMP.format(now.atZone(ZoneId.systemDefault())) + ".pdf";
        final Path target = config.getDownloads().resolve(filename);

        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
        } catch (IllegalArgumentException e) {
            throw new PdfDownloadException(url, "Invalid URL", e);
        }

        try {
            final HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200) {
                    throw new PdfDownloadException(url, "PDF download failed: HTTP " + response.statusCode());
                }

                final String contentType = response.headers().firstValue("Content-Type").orElse("");
                if (!contentType.contains(PDF_CONTENT_TYPE)) {
                    throw new PdfDownloadException(url, "Not a PDF: content type '" + contentType + "'");
                }

                final OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
                if (declared.isPresent() && declared.getAsLong() > maxBytes) {
                    throw new PdfDownloadException(url, "File too large: " + declared.getAsLong() + " bytes");
                }

                Files.createDirectories(target.getParent());
                final long size = copyLimited(body, target, url);

                log.info("Downloaded {} ({} bytes)", filename, size);
                return new DownloadedPdf(target, filename, url, size, contentType, now);
            }
        } catch (IOException e) {
            deleteQuietly(target);
            throw new PdfDownloadException(url, "PDF download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteQuietly(target);
            throw new PdfDownloadException(url, "PDF download interrupted", e);
        }
    }

    /**
     * Removes a downloaded file once the pipeline is done with it.
     */
    public void cleanup(final Path path) {
        deleteQuietly(path);
    }

    private long copyLimited(final InputStream in, final Path target, final String url) throws IOException {
        long total = 0;
        final byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    throw new PdfDownloadException(url, "Download exceeded " + maxBytes + " bytes");
                }
                out.write(buffer, 0, read);
            }
        } catch (PdfDownloadException e) {
            deleteQuietly(target);
            throw e;
        }
        return total;
    }

    private void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Unable to delete {}: {}", path, e.getMessage());
        }
    }
}
