package eu.virtualparadox.finrag.ingest.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a completion response into {@link ParsedContent} in one step: a JSON object (optionally wrapped
 * in a Markdown code fence) becomes {@link ParsedContent.Structured}, anything else is kept verbatim as
 * {@link ParsedContent.Raw}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*\\n(.*?)\\n?```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ParsedContent parse(final String response) {
        if (response == null) {
            return new ParsedContent.Raw("");
        }

        final String candidate = unfence(response.strip());
        if (!candidate.startsWith("{")) {
            return new ParsedContent.Raw(response);
        }

        try {
            final JsonNode node = objectMapper.readTree(candidate);
            if (node instanceof ObjectNode object) {
                return new ParsedContent.Structured(object, response);
            }
        } catch (JsonProcessingException e) {
            log.debug("Response looks like JSON but does not parse, keeping raw text: {}", e.getOriginalMessage());
        }
        return new ParsedContent.Raw(response);
    }

    private String unfence(final String text) {
        final Matcher m = CODE_FENCE.matcher(text);
        return m.matches() ? m.group(1).strip() : text;
    }
}
