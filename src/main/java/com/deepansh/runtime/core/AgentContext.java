package com.deepansh.runtime.core;

import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.ToolCall;
import com.deepansh.runtime.tool.ToolDefinition;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Holds all mutable state for a single agent run.
 * Passed through the ReAct loop instead of scattered fields on AgentLoop.
 */
@Data
@Builder
public class AgentContext {

    /** System message followed by memory as it stood when the run started, then this run's turns */
    private List<Message> messages;
    private List<ToolDefinition> tools;
    private List<ToolCall> executedToolCalls;
    private int currentIteration;
    private String currentStep;
}
