package eu.virtualparadox.finrag.ingest.page;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link CompletionClient} on top of the Spring AI {@link ChatModel}. Model, temperature and token limit
 * are passed through from configuration unchanged.
 */
@Service
@Slf4j
public class ChatModelCompletionClient implements CompletionClient {

    private final ChatModel chatModel;
    private final ChatOptions options;

    public ChatModelCompletionClient(final ChatModel chatModel,
                                     @Value("${finrag.completion.model:gpt-4o-mini}") final String model,
                                     @Value("${finrag.completion.temperature:0.1}") final double temperature,
                                     @Value("${finrag.completion.max-tokens:4000}") final int maxTokens) {
        this.chatModel = chatModel;
        this.options = ChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }

    @Override
    public String complete(final String systemPrompt, final String userContent) {
        final Prompt prompt = new Prompt(
                List.of(new SystemMessage(systemPrompt), new UserMessage(userContent)),
                options
        );

        final ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Completion returned no output");
        }

        final String text = response.getResult().getOutput().getText();
        log.debug("Completion returned {} chars", text == null ? 0 : text.length());
        if (text == null) {
            throw new IllegalStateException("Completion returned no text");
        }
        return text;
    }
}
