package com.devflow.core.llm;

import com.devflow.core.config.AutomationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.ai.chat.client.ChatClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ChatClientCompletionProvider}.
 */
class ChatClientCompletionProviderTest {

    private static ChatClientCompletionProvider provider(String apiKey) {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(mock(ChatClient.class));
        return new ChatClientCompletionProvider(builder, new AutomationProperties(), apiKey);
    }

    @Test
    @DisplayName("available once an API key is configured")
    void availableWithKey() {
        assertTrue(provider("sk-test-123").isAvailable());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", ChatClientCompletionProvider.UNSET_API_KEY})
    @DisplayName("unavailable without a usable API key")
    void unavailableWithoutKey(String apiKey) {
        assertFalse(provider(apiKey).isAvailable());
    }

    @Test
    @DisplayName("agent initialization fails when the provider has no API key")
    void agentInitializationFails() {
        var agent = new LlmDecisionAgent(provider(ChatClientCompletionProvider.UNSET_API_KEY), null, null,
                new AutomationProperties(), null, null, Runnable::run);

        assertFalse(agent.initialize());
        assertFalse(agent.isInitialized());
    }
}
