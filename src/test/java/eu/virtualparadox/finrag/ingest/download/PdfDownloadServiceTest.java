package eu.virtualparadox.finrag.ingest.download;

import com.sun.net.httpserver.HttpServer;
import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.exception.PdfDownloadException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfDownloadServiceTest {

    private static final int ONE_MB = 1024 * 1024;

    @TempDir
    Path downloads;

    private HttpServer server;
    private PdfDownloadService service;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            final byte[] body = "%PDF-1.4 test".getBytes();
            exchange.getResponseHeaders().add("Content-Type", "application/pdf");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/html", exchange -> {
            final byte[] body = "<html></html>".getBytes();
            exchange.getResponseHeaders().add("Content-Type", "text/html");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.createContext("/declared-large", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/pdf");
            exchange.sendResponseHeaders(200, 2L * ONE_MB);
            exchange.close();
        });
        server.createContext("/streamed-large", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/pdf");
            // chunked transfer, no Content-Length
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream out = exchange.getResponseBody()) {
                final byte[] block = new byte[64 * 1024];
                for (int i = 0; i < 40; i++) {
                    out.write(block);
                }
            } catch (IOException e) {
                // client hung up after the limit
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        final ApplicationConfig config = new ApplicationConfig();
        config.setDownloads(downloads);
        service = new PdfDownloadService(HttpClient.newHttpClient(), config,
                Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC),
                base + "/reports/", 1, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private long filesInDownloads() throws IOException {
        try (Stream<Path> files = Files.list(downloads)) {
            return files.count();
        }
    }

    @Test
    @DisplayName("The report URL is the base URL followed by the ticker")
    void reportUrl() {
        assertThat(service.reportUrl("SPY")).isEqualTo(base + "/reports/SPY");
    }

    @Test
    @DisplayName("A PDF response is written to the downloads folder")
    void download_ok() throws IOException {
        final DownloadedPdf pdf = service.download(base + "/ok", "SPY");

        assertThat(pdf.filename()).startsWith("SPY_").endsWith(".pdf").matches("SPY_\\d{8}_\\d{6}\\.pdf");
        assertThat(pdf.path()).exists().hasParent(downloads);
        assertThat(Files.readString(pdf.path())).isEqualTo("%PDF-1.4 test");
        assertThat(pdf.fileSize()).isEqualTo(13);
        assertThat(pdf.contentType()).contains("application/pdf");
        assertThat(pdf.sourceUrl()).isEqualTo(base + "/ok");

        service.cleanup(pdf.path());
        assertThat(pdf.path()).doesNotExist();
    }

    @Test
    @DisplayName("A non-PDF content type is refused")
    void download_wrongContentType() throws IOException {
        assertThatThrownBy(() -> service.download(base + "/html", "SPY"))
                .isInstanceOf(PdfDownloadException.class)
                .hasMessageContaining("text/html");
        assertThat(filesInDownloads()).isZero();
    }

    @Test
    @DisplayName("A non-200 status is refused")
    void download_notFound() {
        assertThatThrownBy(() -> service.download(base + "/missing", "SPY"))
                .isInstanceOf(PdfDownloadException.class)
                .hasMessageContaining("404");
    }

    @Test
    @DisplayName("A declared size above the limit is refused before reading")
    void download_declaredTooLarge() throws IOException {
        assertThatThrownBy(() -> service.download(base + "/declared-large", "SPY"))
                .isInstanceOf(PdfDownloadException.class)
                .hasMessageContaining("too large");
        assertThat(filesInDownloads()).isZero();
    }

    @Test
    @DisplayName("A body growing past the limit is aborted and the partial file deleted")
    void download_streamedTooLarge() throws IOException {
        assertThatThrownBy(() -> service.download(base + "/streamed-large", "SPY"))
                .isInstanceOf(PdfDownloadException.class)
                .hasMessageContaining("exceeded");
        assertThat(filesInDownloads()).isZero();
    }

    @Test
    @DisplayName("Without a base URL no report URL can be built")
    void reportUrl_unconfigured() {
        final PdfDownloadService unconfigured = new PdfDownloadService(HttpClient.newHttpClient(), new ApplicationConfig(),
                Clock.systemUTC(), "", 1, Duration.ofSeconds(1));

        assertThatThrownBy(() -> unconfigured.reportUrl("SPY")).isInstanceOf(IllegalStateException.class);
    }
}
