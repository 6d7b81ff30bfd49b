package com.devflow.core.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Completion provider returning canned text, recording every prompt it receives.
 */
class StubCompletionProvider extends AbstractCompletionProvider {

    final List<List<LlmMessage>> requests = new ArrayList<>();
    private Function<List<LlmMessage>, String> responder;
    private boolean available = true;

    StubCompletionProvider(String content) {
        this(messages -> content);
    }

    StubCompletionProvider(Function<List<LlmMessage>, String> responder) {
        super(new LlmJsonParser());
        this.responder = responder;
    }

    void respondWith(String content) {
        this.responder = messages -> content;
    }

    void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public LlmResponse complete(List<LlmMessage> messages) {
        requests.add(messages);
        return new LlmResponse(responder.apply(messages), new TokenUsage(10, 5, 15), "stub-model");
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String getName() {
        return "stub";
    }
}
