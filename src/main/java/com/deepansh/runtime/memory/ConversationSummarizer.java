package com.deepansh.runtime.memory;

import com.deepansh.runtime.llm.LlmClient;
import com.deepansh.runtime.model.ChatOptions;
import com.deepansh.runtime.model.LlmResponse;
import com.deepansh.runtime.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Collapses a window of messages into one paragraph with a single extra model call.
 */
@Slf4j
public class ConversationSummarizer {

    static final String SUMMARY_INSTRUCTION =
            "You are a helpful summarizer. Summarize the following conversation history into a single "
                    + "concise paragraph that captures the key points, ongoing topics, and current context. "
                    + "Keep it under 500 words.";

    private final LlmClient llmClient;

    public ConversationSummarizer(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    /**
     * @throws IllegalStateException when the model returns no text
     * @throws RuntimeException      whatever the client throws
     */
    public String summarize(List<Message> messages) {
        String transcript = messages.stream()
                .map(m -> m.getRole() + ": " + (m.getContent() != null ? m.getContent() : ""))
                .collect(Collectors.joining("\n"));

        LlmResponse response = llmClient.chat(
                List.of(Message.system(SUMMARY_INSTRUCTION), Message.user(transcript)),
                List.of(), ChatOptions.defaults(), null);

        String content = response.getContent();
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("Empty summary response");
        }
        log.info("Summarized conversation history [messages={}, summaryLength={}]",
                messages.size(), content.length());
        return content;
    }
}
