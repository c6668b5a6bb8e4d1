package com.deepansh.runtime.tool;

/**
 * Outcome of one dispatched tool call. {@code output} is always set and is what the model sees;
 * {@code error} is set only when the tool threw or timed out.
 */
public record ToolExecution(String toolName, String output, Throwable error, long latencyMs) {

    public boolean failed() {
        return error != null;
    }
}
