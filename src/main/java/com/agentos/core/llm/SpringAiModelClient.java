package com.agentos.core.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;

/**
 * {@link ModelClient} backed by a Spring AI {@link ChatClient}.
 */
public class SpringAiModelClient implements ModelClient {

    private final String alias;
    private final ChatClient chatClient;

    public SpringAiModelClient(String alias, ChatClient chatClient) {
        this.alias = alias;
        this.chatClient = chatClient;
    }

    @Override
    public ModelReply complete(String prompt) {
        ChatResponse response = chatClient.prompt()
                .user(prompt)
                .call()
                .chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmEmptyResponseException("Model " + alias + " returned no result");
        }
        String text = response.getResult().getOutput().getText();
        return new ModelReply(text, usageOf(response));
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.EMPTY;
        }
        Usage usage = response.getMetadata().getUsage();
        return new TokenUsage(
                usage.getPromptTokens() != null ? usage.getPromptTokens() : 0,
                usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0);
    }
}
