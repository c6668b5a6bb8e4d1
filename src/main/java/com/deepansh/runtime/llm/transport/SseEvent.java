package com.deepansh.runtime.llm.transport;

/** One dispatched Server-Sent Event. {@code event} is null when the frame had no event line. */
public record SseEvent(String event, String data) {
}
