package eu.virtualparadox.finrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Filesystem layout and prompt overrides, bound from {@code finrag.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "finrag")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path downloads;
    private Path models;

    /**
     * Prompt texts keyed by prompt type. Entries here replace the built-in prompts of the same name.
     */
    private Map<String, String> prompts = new HashMap<>();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (downloads != null) Files.createDirectories(downloads);
        if (models != null) Files.createDirectories(models);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }
}
