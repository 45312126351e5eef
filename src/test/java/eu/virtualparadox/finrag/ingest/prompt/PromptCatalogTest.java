package eu.virtualparadox.finrag.ingest.prompt;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptCatalogTest {

    private static PromptCatalog catalog(final Map<String, String> overrides) {
        final ApplicationConfig config = new ApplicationConfig();
        config.setPrompts(overrides);
        return new PromptCatalog(config);
    }

    @Test
    @DisplayName("A custom prompt wins over the prompt type")
    void resolve_customPromptWins() {
        assertThat(catalog(Map.of()).resolve(PromptCatalog.FINANCIAL_TYPE, "Summarise the page")).isEqualTo("Summarise the page");
    }

    @Test
    @DisplayName("Built-in types resolve to different prompts")
    void resolve_builtInTypes() {
        final PromptCatalog catalog = catalog(Map.of());

        assertThat(catalog.resolve("default", null)).contains("JSON");
        assertThat(catalog.resolve("FINANCIAL", " ")).contains("financial").isNotEqualTo(catalog.get("default"));
    }

    @Test
    @DisplayName("Unknown or missing types fall back to the default prompt")
    void resolve_unknownTypeFallsBack() {
        final PromptCatalog catalog = catalog(Map.of());

        assertThat(catalog.resolve("esg", null)).isEqualTo(catalog.get(PromptCatalog.DEFAULT_TYPE));
        assertThat(catalog.resolve(null, null)).isEqualTo(catalog.get(PromptCatalog.DEFAULT_TYPE));
    }

    @Test
    @DisplayName("Configured prompts replace and extend the built-in ones")
    void resolve_configuredOverrides() {
        final PromptCatalog catalog = catalog(Map.of("default", "Custom default", "esg", "ESG prompt"));

        assertThat(catalog.get("default")).isEqualTo("Custom default");
        assertThat(catalog.get("esg")).isEqualTo("ESG prompt");
    }
}
