package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.model.LlmChunk;

import java.util.List;

/**
 * Provider-specific state machine turning SSE events into canonical chunks.
 * One instance per stream.
 */
public interface SseStreamDecoder {

    List<LlmChunk> decode(SseEvent event);

    /** True once the provider signalled the end of the turn; the reader stops there. */
    boolean isFinished();

    /** Chunks buffered until the end of the turn, such as aggregated tool calls. */
    List<LlmChunk> finish();
}
