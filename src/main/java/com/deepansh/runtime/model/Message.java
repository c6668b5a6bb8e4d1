package com.deepansh.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider-neutral chat message. Adapters translate to and from this shape;
 * nothing above the llm package ever sees a vendor format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the function name, used by providers that key results by name */
    private String name;

    /** Present when role = assistant and the model requested tool calls */
    private List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(Role.assistant).content(content).toolCalls(List.copyOf(toolCalls)).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String content) {
        return Message.builder().role(Role.tool).toolCallId(toolCallId).name(toolName).content(content).build();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /** A message with no text must carry tool calls or a tool call id to be worth keeping. */
    @JsonIgnore
    public boolean isStorable() {
        return (content != null && !content.isEmpty()) || hasToolCalls() || toolCallId != null;
    }
}
