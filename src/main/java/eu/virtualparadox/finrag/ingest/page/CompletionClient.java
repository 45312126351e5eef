package eu.virtualparadox.finrag.ingest.page;

/**
 * Single attempt at a chat completion. Implementations may throw on any transport or model error.
 */
public interface CompletionClient {

    String complete(final String systemPrompt, final String userContent);

}
