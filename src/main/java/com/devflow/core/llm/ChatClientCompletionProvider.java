package com.devflow.core.llm;

import com.devflow.core.config.AutomationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link CompletionProvider} backed by Spring AI's {@link ChatClient}.
 * Model, temperature and token limit come from {@code devflow.automation.llm}.
 * The provider reports itself unavailable until {@code spring.ai.openai.api-key} is set.
 */
@Service
public class ChatClientCompletionProvider extends AbstractCompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientCompletionProvider.class);

    static final String UNSET_API_KEY = "not-set";

    private final ChatClient chatClient;
    private final AutomationProperties.Llm llmProperties;
    private final String apiKey;

    public ChatClientCompletionProvider(ChatClient.Builder builder,
                                        AutomationProperties automation,
                                        @Value("${spring.ai.openai.api-key:}") String apiKey) {
        super(new LlmJsonParser());
        this.chatClient = builder.build();
        this.llmProperties = automation.getLlm();
        this.apiKey = apiKey;
        log.info("ChatClient completion provider initialized for {}", llmProperties.getProvider());
    }

    @Override
    public LlmResponse complete(List<LlmMessage> messages) {
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .messages(toSpringMessages(messages))
                    .options(buildOptions())
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            throw new LlmProviderException("Completion request to " + getName() + " failed: " + e.getMessage(), e);
        }
        log.debug("Completion from {} took {} ms", getName(), System.currentTimeMillis() - start);

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmEmptyResponseException("LLM returned no result from " + getName());
        }
        String content = response.getResult().getOutput().getText();
        return new LlmResponse(content, usageOf(response), response.getMetadata().getModel());
    }

    @Override
    public boolean isAvailable() {
        return chatClient != null
                && apiKey != null
                && !apiKey.isBlank()
                && !UNSET_API_KEY.equals(apiKey);
    }

    @Override
    public String getName() {
        return "spring-ai:" + llmProperties.getProvider();
    }

    private ChatOptions buildOptions() {
        ChatOptions.Builder options = ChatOptions.builder()
                .temperature(llmProperties.getTemperature())
                .maxTokens(llmProperties.getMaxTokens());
        if (llmProperties.getModel() != null && !llmProperties.getModel().isBlank()) {
            options.model(llmProperties.getModel());
        }
        return options.build();
    }

    private static List<Message> toSpringMessages(List<LlmMessage> messages) {
        return messages.stream()
                .map(message -> switch (message.role()) {
                    case SYSTEM -> (Message) new SystemMessage(message.content());
                    case USER -> new UserMessage(message.content());
                    case ASSISTANT -> new AssistantMessage(message.content());
                })
                .toList();
    }

    private static TokenUsage usageOf(ChatResponse response) {
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return TokenUsage.none();
        }
        return new TokenUsage(orZero(usage.getPromptTokens()), orZero(usage.getCompletionTokens()),
                orZero(usage.getTotalTokens()));
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
