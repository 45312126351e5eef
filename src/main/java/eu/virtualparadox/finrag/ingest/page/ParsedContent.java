package eu.virtualparadox.finrag.ingest.page;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What one completion call produced for a page: either a JSON object or the response text as is.
 */
public sealed interface ParsedContent permits ParsedContent.Structured, ParsedContent.Raw {

    /**
     * Text used when the page is merged into the report body.
     */
    String contentText();

    /**
     * @param fields the JSON object returned by the model
     * @param source response text the object was parsed from
     */
    record Structured(ObjectNode fields, String source) implements ParsedContent {

        private static final String FIELD_CONTENT = "content";

        @Override
        public String contentText() {
            final JsonNode content = fields.get(FIELD_CONTENT);
            if (content != null && content.isTextual()) {
                return content.asText();
            }
            return fields.toString();
        }

        public Optional<String> text(final String name) {
            final JsonNode node = fields.get(name);
            if (node == null || !node.isTextual() || node.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(node.asText());
        }

        public List<String> textList(final String name) {
            final JsonNode node = fields.get(name);
            final List<String> values = new ArrayList<>();
            if (node != null && node.isArray()) {
                for (final JsonNode item : node) {
                    if (item.isValueNode() && !item.asText().isBlank()) {
                        values.add(item.asText());
                    }
                }
            }
            return values;
        }
    }

    record Raw(String text) implements ParsedContent {

        @Override
        public String contentText() {
            return text;
        }
    }
}
