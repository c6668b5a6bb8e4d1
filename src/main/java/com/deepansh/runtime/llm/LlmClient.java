package com.deepansh.runtime.llm;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.model.ChatOptions;
import com.deepansh.runtime.model.LlmChunk;
import com.deepansh.runtime.model.LlmResponse;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.tool.ToolDefinition;

import java.util.List;
import java.util.stream.Stream;

/**
 * Provider-neutral model client. Each implementation owns one vendor's wire format,
 * its retry policy and its pooled HTTP transport.
 */
public interface LlmClient extends AutoCloseable {

    String getProviderName();

    /**
     * Send the full conversation and available tool schemas to the model.
     *
     * @param messages full conversation so far (system + user + assistant + tool results)
     * @param tools    tool definitions the model may invoke, possibly empty
     * @param options  sampling overrides, null fields use the configured defaults
     * @param token    checked before the request goes out and before every retry, may be null
     * @return final text, or tool calls the model wants executed
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, ChatOptions options, CancellationToken token);

    /**
     * Streaming variant. The request is sent, and retried, before this method returns;
     * the body is then read lazily as the returned stream is consumed.
     * Tool calls arrive complete, never as partial argument fragments.
     * Close the stream when abandoning it early.
     */
    Stream<LlmChunk> streamChat(List<Message> messages, List<ToolDefinition> tools, ChatOptions options, CancellationToken token);

    /** Releases the pooled connections. */
    @Override
    void close();
}
