package eu.virtualparadox.finrag.ingest.page;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new ObjectMapper());

    @Test
    @DisplayName("A JSON object becomes structured content")
    void parse_jsonObject() {
        final ParsedContent parsed = parser.parse("{\"content\":\"Net assets 1.2bn\",\"summary\":\"Fund size\",\"keywords\":[\"nav\",\"fund\"]}");

        assertThat(parsed).isInstanceOf(ParsedContent.Structured.class);
        final ParsedContent.Structured structured = (ParsedContent.Structured) parsed;
        assertThat(structured.contentText()).isEqualTo("Net assets 1.2bn");
        assertThat(structured.text("summary")).contains("Fund size");
        assertThat(structured.textList("keywords")).containsExactly("nav", "fund");
        assertThat(structured.text("category")).isEmpty();
    }

    @Test
    @DisplayName("A fenced JSON block is unwrapped before parsing")
    void parse_fencedJson() {
        final ParsedContent parsed = parser.parse("```json\n{\"content\": \"Holdings table\"}\n```");

        assertThat(parsed).isInstanceOf(ParsedContent.Structured.class);
        assertThat(parsed.contentText()).isEqualTo("Holdings table");
    }

    @Test
    @DisplayName("Structured content without a content field merges as its JSON text")
    void contentText_fallsBackToJson() {
        final ParsedContent parsed = parser.parse("{\"summary\":\"s\"}");

        assertThat(parsed.contentText()).isEqualTo("{\"summary\":\"s\"}");
    }

    @Test
    @DisplayName("Plain text is kept verbatim as raw content")
    void parse_plainText() {
        final String response = "  # Page title\n\nSome markdown  ";

        final ParsedContent parsed = parser.parse(response);

        assertThat(parsed).isEqualTo(new ParsedContent.Raw(response));
        assertThat(parsed.contentText()).isEqualTo(response);
    }

    @Test
    @DisplayName("Broken JSON and JSON arrays stay raw")
    void parse_nonObjectJson() {
        assertThat(parser.parse("{\"content\": \"unterminated")).isInstanceOf(ParsedContent.Raw.class);
        assertThat(parser.parse("[1, 2, 3]")).isInstanceOf(ParsedContent.Raw.class);
        assertThat(parser.parse(null)).isEqualTo(new ParsedContent.Raw(""));
    }
}
