package com.deepansh.runtime.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One fragment of a streamed model turn. Any combination of fields may be set.
 * Tool calls always arrive complete; adapters buffer partial argument JSON themselves.
 */
@Data
@Builder
public class LlmChunk {

    private String textDelta;
    private List<ToolCall> toolCalls;
    private String finishReason;
    private TokenUsage usage;

    public static LlmChunk text(String delta) {
        return LlmChunk.builder().textDelta(delta).build();
    }

    public static LlmChunk toolCalls(List<ToolCall> calls) {
        return LlmChunk.builder().toolCalls(List.copyOf(calls)).build();
    }

    public static LlmChunk tail(String finishReason, TokenUsage usage) {
        return LlmChunk.builder().finishReason(finishReason).usage(usage).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
