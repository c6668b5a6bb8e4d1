package com.deepansh.runtime.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical non-streaming response. Every provider returns exactly one choice,
 * so the choice is flattened into this object.
 */
@Data
@Builder
public class LlmResponse {

    /** Final text, or interim text the model sent alongside tool calls */
    private String content;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    private String finishReason;

    private TokenUsage usage;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
