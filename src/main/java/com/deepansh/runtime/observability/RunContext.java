package com.deepansh.runtime.observability;

import com.deepansh.runtime.model.TokenUsage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each agent run, populated throughout,
 * then summarized in the completion log line and the FINAL response.
 *
 * Kept separate from AgentContext (which holds conversation state)
 * so observability concerns don't bleed into the core loop.
 */
@Getter
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();
    private TokenUsage usage = TokenUsage.ZERO;

    public void recordToolCall(String toolName, long latencyMs, boolean failed) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, failed));
    }

    public void addUsage(TokenUsage callUsage) {
        usage = usage.plus(callUsage);
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long failedToolCalls() {
        return toolCallRecords.stream().filter(ToolCallRecord::failed).count();
    }

    public record ToolCallRecord(String toolName, long latencyMs, boolean failed) {}
}
