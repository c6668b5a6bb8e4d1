package com.deepansh.runtime.llm;

import com.deepansh.runtime.llm.transport.PooledHttpTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import java.time.Duration;

/** Shared fixtures for the provider adapter tests. */
final class LlmTestSupport {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private LlmTestSupport() {
    }

    static LlmProperties.Retry fastRetry() {
        LlmProperties.Retry retry = new LlmProperties.Retry();
        retry.setInitialBackoff(Duration.ofMillis(10));
        return retry;
    }

    static PooledHttpTransport transport() {
        return PooledHttpTransport.create(new LlmProperties.Http());
    }

    static LlmProviderProperties props(MockWebServer server, String basePath, String model) {
        LlmProviderProperties props = LlmProviderProperties.of(
                server.url(basePath).toString().replaceAll("/$", ""), model, 256);
        props.setApiKey("test-key");
        return props;
    }

    static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    /** One SSE frame per data payload. Event names are given as "name|payload". */
    static MockResponse sse(String... frames) {
        StringBuilder body = new StringBuilder();
        for (String frame : frames) {
            int bar = frame.indexOf('|');
            if (bar > 0 && !frame.startsWith("{")) {
                body.append("event: ").append(frame, 0, bar).append('\n');
                frame = frame.substring(bar + 1);
            }
            body.append("data: ").append(frame).append("\n\n");
        }
        return new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(body.toString());
    }

    static JsonNode body(RecordedRequest request) throws Exception {
        return MAPPER.readTree(request.getBody().readUtf8());
    }
}
