package com.deepansh.runtime.llm;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.exception.AgentCancelledException;
import com.deepansh.runtime.exception.LlmApiException;
import com.deepansh.runtime.exception.RateLimitedException;
import com.deepansh.runtime.model.ChatOptions;
import com.deepansh.runtime.model.LlmChunk;
import com.deepansh.runtime.model.LlmResponse;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.TokenUsage;
import com.deepansh.runtime.model.ToolCall;
import com.deepansh.runtime.resilience.LlmRetryPolicy;
import com.deepansh.runtime.tool.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.deepansh.runtime.llm.LlmTestSupport.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCompatibleClientTest {

    private MockWebServer server;
    private OpenAiCompatibleClient client;

    private static final ToolDefinition ECHO = ToolDefinition.builder()
            .name("echo")
            .description("Echoes text")
            .inputSchema(Map.of("type", "object", "properties", Map.of("text", Map.of("type", "string"))))
            .build();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = new OpenAiCompatibleClient("openai", props(server, "/v1", "gpt-test"), MAPPER, transport(),
                LlmRetryPolicy.passThrough("openai", fastRetry()));
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void chat_sendsOpenAiShapeAndParsesToolCalls() throws Exception {
        server.enqueue(json("""
                {"choices":[{"message":{"content":null,"tool_calls":[
                  {"id":"call_2","type":"function","function":{"name":"echo","arguments":"{\\"text\\":\\"again\\"}"}}]},
                  "finish_reason":"tool_calls"}],
                 "usage":{"prompt_tokens":20,"completion_tokens":8,"total_tokens":28}}
                """));

        List<Message> conversation = List.of(
                Message.system("be brief"),
                Message.user("echo hi"),
                Message.assistantToolCalls(null, List.of(new ToolCall("call_1", "echo", "{\"text\":\"hi\"}"))),
                Message.toolResult("call_1", "echo", "hi"));

        LlmResponse response = client.chat(conversation, List.of(ECHO), ChatOptions.builder().maxTokens(64).build(), null);

        assertThat(response.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getId()).isEqualTo("call_2");
            assertThat(call.getToolName()).isEqualTo("echo");
            assertThat(call.getArguments()).isEqualTo("{\"text\":\"again\"}");
        });
        assertThat(response.getFinishReason()).isEqualTo("tool_calls");
        assertThat(response.getUsage()).isEqualTo(new TokenUsage(20, 8, 28));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");
        JsonNode body = body(request);
        assertThat(body.path("model").asText()).isEqualTo("gpt-test");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(64);
        assertThat(body.path("messages")).hasSize(4);
        assertThat(body.path("messages").path(2).path("tool_calls").path(0).path("function").path("name").asText())
                .isEqualTo("echo");
        assertThat(body.path("messages").path(3).path("tool_call_id").asText()).isEqualTo("call_1");
        assertThat(body.path("tools").path(0).path("type").asText()).isEqualTo("function");
        assertThat(body.path("tool_choice").asText()).isEqualTo("auto");
        assertThat(body.has("stream")).isFalse();
    }

    @Test
    void chat_rateLimitedOnEveryAttempt_throwsRateLimitedAfterThreeAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));
        }

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of(), null, null))
                .isInstanceOf(RateLimitedException.class);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void chat_retryAfterHeader_waitsAtLeastThatLong() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1"));
        server.enqueue(json("{\"choices\":[{\"message\":{\"content\":\"ok\"},\"finish_reason\":\"stop\"}]}"));

        long start = System.nanoTime();
        LlmResponse response = client.chat(List.of(Message.user("hi")), List.of(), null, null);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(response.getContent()).isEqualTo("ok");
        assertThat(elapsedMs).isGreaterThanOrEqualTo(1000);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void chat_serverError_isNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("upstream exploded"));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of(), null, null))
                .isInstanceOfSatisfying(LlmApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.getResponseBody()).isEqualTo("upstream exploded");
                });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void chat_cancelledToken_sendsNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of(), null, token))
                .isInstanceOf(AgentCancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void chat_toolUseFailed_recoversToolCallFromFailedGeneration() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("""
                {"error":{"code":"tool_use_failed",
                 "failed_generation":"<function=echo{\\"text\\": \\"hi\\"}></function>"}}
                """));

        LlmResponse response = client.chat(List.of(Message.user("echo hi")), List.of(ECHO), null, null);

        assertThat(response.getFinishReason()).isEqualTo("tool_calls");
        assertThat(response.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getToolName()).isEqualTo("echo");
            assertThat(call.getArguments()).isEqualTo("{\"text\": \"hi\"}");
            assertThat(call.getId()).startsWith("groq-recovered-");
        });
    }

    @Test
    void streamChat_mergesArgumentFragmentsIntoOneCompleteCall() throws Exception {
        server.enqueue(sse(
                "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                """
                {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"echo","arguments":"{\\"te"}}]}}]}""",
                """
                {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"xt\\":\\"hi\\"}"}}]}}]}""",
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}",
                "{\"choices\":[],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":7,\"total_tokens\":12}}",
                "[DONE]"));

        List<LlmChunk> chunks;
        try (Stream<LlmChunk> stream = client.streamChat(List.of(Message.user("hi")), List.of(ECHO), null, null)) {
            chunks = stream.toList();
        }

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0).getTextDelta()).isEqualTo("Hel");
        assertThat(chunks.get(1).getTextDelta()).isEqualTo("lo");
        LlmChunk last = chunks.get(2);
        assertThat(last.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getId()).isEqualTo("call_1");
            assertThat(call.getArguments()).isEqualTo("{\"text\":\"hi\"}");
        });
        assertThat(last.getFinishReason()).isEqualTo("tool_calls");
        assertThat(last.getUsage()).isEqualTo(new TokenUsage(5, 7, 12));

        JsonNode body = body(server.takeRequest());
        assertThat(body.path("stream").asBoolean()).isTrue();
        assertThat(body.path("stream_options").path("include_usage").asBoolean()).isTrue();
    }

    @Test
    void streamChat_malformedFrame_isSkipped() {
        server.enqueue(sse(
                "{\"choices\":[{\"delta\":{\"content\":\"a\"}}]}",
                "{not json",
                "{\"choices\":[{\"delta\":{\"content\":\"b\"},\"finish_reason\":\"stop\"}]}",
                "[DONE]"));

        List<LlmChunk> chunks;
        try (Stream<LlmChunk> stream = client.streamChat(List.of(Message.user("hi")), List.of(), null, null)) {
            chunks = stream.toList();
        }

        assertThat(chunks).extracting(LlmChunk::getTextDelta).containsExactly("a", "b", null);
        assertThat(chunks.get(2).getFinishReason()).isEqualTo("stop");
    }

    @Test
    void streamChat_errorStatus_throwsBeforeReturning() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        assertThatThrownBy(() -> client.streamChat(List.of(Message.user("hi")), List.of(), null, null))
                .isInstanceOfSatisfying(LlmApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(401));
    }
}
