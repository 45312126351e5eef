package eu.virtualparadox.finrag.ingest.prompt;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * System prompts used for page parsing, looked up by type.
 * <p>Built-in prompts can be replaced or extended with {@code finrag.prompts.<type>} entries.</p>
 */
@Component
@Slf4j
public class PromptCatalog {

    public static final String DEFAULT_TYPE = "default";
    public static final String FINANCIAL_TYPE = "financial";

    private static final String DEFAULT_PROMPT = String.join("\n",
            "You convert one page of a PDF document into clean, structured text.",
            "Rules:",
            "1. Use ONLY the text of the page; do not invent facts.",
            "2. Keep headings, lists and tables, rendering tables as Markdown.",
            "3. Answer with a single JSON object and nothing else, with these fields:",
            "   \"content\": the cleaned page text as Markdown,",
            "   \"summary\": one or two sentences describing the page,",
            "   \"keywords\": a list of up to ten key terms,",
            "   \"category\": a one or two word label for the page."
    );

    private static final String FINANCIAL_PROMPT = String.join("\n",
            "You are a financial analyst reading one page of a fund or company report.",
            "Rules:",
            "1. Use ONLY the text of the page; do not invent or estimate numbers.",
            "2. Keep every figure with its unit, currency and reporting period.",
            "3. Render tables (holdings, returns, fees, balance sheet items) as Markdown tables.",
            "4. Answer with a single JSON object and nothing else, with these fields:",
            "   \"content\": the page as Markdown,",
            "   \"summary\": the key financial facts of the page in one or two sentences,",
            "   \"keywords\": a list of up to ten instruments, metrics or terms,",
            "   \"category\": one of performance, holdings, fees, risk, overview, other."
    );

    private final Map<String, String> prompts = new HashMap<>();

    public PromptCatalog(final ApplicationConfig config) {
        prompts.put(DEFAULT_TYPE, DEFAULT_PROMPT);
        prompts.put(FINANCIAL_TYPE, FINANCIAL_PROMPT);
        config.getPrompts().forEach((type, text) -> {
            if (StringUtils.isNotBlank(text)) {
                prompts.put(normalise(type), text);
            }
        });
        log.info("Prompt types available: {}", prompts.keySet());
    }

    /**
     * @param promptType   requested type, unknown or blank types fall back to {@value #DEFAULT_TYPE}
     * @param customPrompt caller supplied prompt, wins when non-blank
     * @return the system prompt to send with every page
     */
    public String resolve(final String promptType, final String customPrompt) {
        if (StringUtils.isNotBlank(customPrompt)) {
            return customPrompt;
        }
        return get(promptType);
    }

    public String get(final String promptType) {
        final String key = StringUtils.isBlank(promptType) ? DEFAULT_TYPE : normalise(promptType);
        final String prompt = prompts.get(key);
        if (prompt == null) {
            log.warn("Unknown prompt type '{}', using '{}'", promptType, DEFAULT_TYPE);
            return prompts.get(DEFAULT_TYPE);
        }
        return prompt;
    }

    private String normalise(final String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
