package com.deepansh.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the agent loop hands back to its caller. A blocking run returns a single
 * FINAL response; a streamed run yields any number of the other kinds first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentResponse {

    public enum Kind {
        FINAL, TEXT_DELTA, TOOL_CALLS, USAGE
    }

    private Kind kind;

    /** Final answer for FINAL, fragment for TEXT_DELTA */
    private String text;

    /** The batch for TOOL_CALLS, every executed call of the run for FINAL */
    private List<ToolCall> toolCalls;

    private String finishReason;

    /** Per-call usage for USAGE, aggregated run usage for FINAL */
    private TokenUsage usage;

    private Integer iterationsUsed;

    private String agentName;

    public static AgentResponse textDelta(String fragment) {
        return AgentResponse.builder().kind(Kind.TEXT_DELTA).text(fragment).build();
    }

    public static AgentResponse toolCallBatch(List<ToolCall> calls) {
        return AgentResponse.builder().kind(Kind.TOOL_CALLS).toolCalls(new ArrayList<>(calls)).build();
    }

    public static AgentResponse usageTail(String finishReason, TokenUsage usage) {
        return AgentResponse.builder().kind(Kind.USAGE).finishReason(finishReason).usage(usage).build();
    }

    @JsonIgnore
    public boolean isFinal() {
        return kind == Kind.FINAL;
    }
}
