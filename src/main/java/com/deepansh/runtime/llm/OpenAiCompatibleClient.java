package com.deepansh.runtime.llm;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.exception.AgentException;
import com.deepansh.runtime.exception.LlmApiException;
import com.deepansh.runtime.llm.transport.HttpErrors;
import com.deepansh.runtime.llm.transport.PooledHttpTransport;
import com.deepansh.runtime.llm.transport.SseChunkIterator;
import com.deepansh.runtime.llm.transport.SseEvent;
import com.deepansh.runtime.llm.transport.SseEventReader;
import com.deepansh.runtime.llm.transport.SseStreamDecoder;
import com.deepansh.runtime.llm.transport.StreamingResponse;
import com.deepansh.runtime.model.ChatOptions;
import com.deepansh.runtime.model.LlmChunk;
import com.deepansh.runtime.model.LlmResponse;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.TokenUsage;
import com.deepansh.runtime.model.ToolCall;
import com.deepansh.runtime.resilience.LlmRetryPolicy;
import com.deepansh.runtime.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StopWatch;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static com.deepansh.runtime.llm.JsonSupport.textOrNull;

/**
 * OpenAI-compatible chat completions client. Works with OpenAI, Groq, and any
 * server exposing /chat/completions. Messages and tool definitions map almost 1:1.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                          |
 * |------------------------|-------------------------------------------------|
 * | 429 rate limit         | retried, Retry-After honoured, then RateLimited |
 * | network error          | retried, then LlmTransportException             |
 * | 400 tool_use_failed    | recover from failed_generation XML, continue    |
 * | other non-2xx          | LlmApiException, not retried                    |
 *
 * Streamed tool calls arrive as argument fragments keyed by index. They are
 * concatenated here and emitted once, complete, in the final chunk.
 */
@Slf4j
public class OpenAiCompatibleClient implements LlmClient {

    // Matches both broken XML formats Groq emits:
    // <function=web_search({"arg": "val"})</function>
    // <function=web_search{"arg": "val"}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private static final String DONE_SENTINEL = "[DONE]";
    private static final String RECOVERY_FALLBACK =
            "I encountered a tool formatting issue. Please rephrase your request.";

    private final String providerName;
    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final PooledHttpTransport transport;
    private final LlmRetryPolicy retryPolicy;
    private final RestClient restClient;

    public OpenAiCompatibleClient(String providerName,
                                  LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  PooledHttpTransport transport,
                                  LlmRetryPolicy retryPolicy) {
        this.providerName = providerName;
        this.props = props;
        this.objectMapper = objectMapper;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.restClient = transport.restClientBuilder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public LlmResponse chat(List<Message> messages,
                            List<ToolDefinition> tools,
                            ChatOptions options,
                            CancellationToken token) {
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options, false));

        log.debug("Sending {} messages to {} [model={}]", messages.size(), providerName, props.getModel());
        StopWatch watch = new StopWatch(providerName);
        watch.start();
        try {
            String body = retryPolicy.execute(token, () -> restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestJson)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw HttpErrors.fromResponse(providerName, res);
                    })
                    .body(String.class));
            return parseResponse(JsonSupport.readTree(objectMapper, providerName, body));
        } catch (LlmApiException e) {
            if (isToolUseFailed(e)) {
                return recoverFromGroqToolUseFailure(e.getResponseBody());
            }
            throw e;
        } finally {
            watch.stop();
            log.debug("{} chat round-trip took {}ms", providerName, watch.getTotalTimeMillis());
        }
    }

    @Override
    public Stream<LlmChunk> streamChat(List<Message> messages,
                                       List<ToolDefinition> tools,
                                       ChatOptions options,
                                       CancellationToken token) {
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options, true));

        log.debug("Streaming {} messages to {} [model={}]", messages.size(), providerName, props.getModel());
        try {
            StreamingResponse response = retryPolicy.execute(token, () -> restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(requestJson)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            try {
                                throw HttpErrors.fromResponse(providerName, res);
                            } finally {
                                res.close();
                            }
                        }
                        return StreamingResponse.open(res);
                    }, false));

            return SseChunkIterator.stream(providerName,
                    new SseEventReader(response.getBody(), token), new StreamDecoder(), token, response);
        } catch (LlmApiException e) {
            if (isToolUseFailed(e)) {
                return toChunks(recoverFromGroqToolUseFailure(e.getResponseBody())).stream();
            }
            throw e;
        }
    }

    @Override
    public void close() {
        transport.close();
    }

    // ─── Request ──────────────────────────────────────────────────────────────

    private Map<String, Object> buildRequestBody(List<Message> messages,
                                                 List<ToolDefinition> tools,
                                                 ChatOptions options,
                                                 boolean stream) {
        ChatOptions opts = options != null ? options : ChatOptions.defaults();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("messages", messages.stream().map(this::formatMessage).toList());
        body.put("max_tokens", opts.getMaxTokens() != null ? opts.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", opts.getTemperature() != null ? opts.getTemperature() : props.getTemperature());

        Double topP = opts.getTopP() != null ? opts.getTopP() : props.getTopP();
        if (topP != null) body.put("top_p", topP);

        List<String> stop = opts.getStop() != null ? opts.getStop() : props.getStop();
        if (stop != null && !stop.isEmpty()) body.put("stop", stop);

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant && msg.hasToolCalls()) {
            // the assistant turn must echo its tool_calls so results can be correlated
            m.put("content", msg.getContent());
            m.put("tool_calls", msg.getToolCalls().stream()
                    .map(tc -> {
                        Map<String, Object> fn = new LinkedHashMap<>();
                        fn.put("name", tc.getToolName());
                        fn.put("arguments", tc.getArguments() != null ? tc.getArguments() : "{}");

                        Map<String, Object> tcMap = new LinkedHashMap<>();
                        tcMap.put("id", tc.getId());
                        tcMap.put("type", "function");
                        tcMap.put("function", fn);
                        return tcMap;
                    })
                    .toList());
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    // ─── Response ─────────────────────────────────────────────────────────────

    private LlmResponse parseResponse(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");
        String finishReason = textOrNull(choice.path("finish_reason"));
        TokenUsage usage = parseUsage(response);

        log.debug("{} finish_reason: {} usage: {}", providerName, finishReason, usage);

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(ToolCall.builder()
                    .id(textOrNull(call.path("id")))
                    .toolName(textOrNull(function.path("name")))
                    .arguments(rawArguments(function.path("arguments")))
                    .build());
        }

        return LlmResponse.builder()
                .content(textOrNull(message.path("content")))
                .toolCalls(toolCalls)
                .finishReason(finishReason)
                .usage(usage)
                .build();
    }

    /** Standard "usage" object, or Groq's "x_groq.usage" on streamed frames. */
    private TokenUsage parseUsage(JsonNode node) {
        TokenUsage usage = JsonSupport.usage(node.get("usage"),
                "prompt_tokens", "completion_tokens", "total_tokens");
        if (usage == null) {
            usage = JsonSupport.usage(node.path("x_groq").get("usage"),
                    "prompt_tokens", "completion_tokens", "total_tokens");
        }
        return usage;
    }

    private static String rawArguments(JsonNode arguments) {
        if (arguments.isTextual()) return arguments.asText();
        if (arguments.isMissingNode() || arguments.isNull()) return "{}";
        return arguments.toString();
    }

    private List<LlmChunk> toChunks(LlmResponse response) {
        List<LlmChunk> chunks = new ArrayList<>();
        if (response.getContent() != null && !response.getContent().isEmpty()) {
            chunks.add(LlmChunk.text(response.getContent()));
        }
        chunks.add(LlmChunk.builder()
                .toolCalls(response.hasToolCalls() ? response.getToolCalls() : null)
                .finishReason(response.getFinishReason())
                .usage(response.getUsage())
                .build());
        return chunks;
    }

    // ─── Groq tool_use_failed recovery ────────────────────────────────────────

    private static boolean isToolUseFailed(LlmApiException e) {
        return e.getStatusCode() == 400
                && e.getResponseBody() != null
                && e.getResponseBody().contains("tool_use_failed");
    }

    /**
     * Groq's tool_use_failed error contains the broken generation in "failed_generation".
     * Parse the XML format and extract the tool call to continue the agent loop.
     */
    private LlmResponse recoverFromGroqToolUseFailure(String errorBody) {
        try {
            JsonNode error = objectMapper.readTree(errorBody).path("error");
            String failedGeneration = textOrNull(error.path("failed_generation"));

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("{} tool_use_failed with no failed_generation, cannot recover", providerName);
                return plainTextResponse(RECOVERY_FALLBACK);
            }

            log.debug("Recovering from tool_use_failed. Generation: {}", failedGeneration);

            Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
            if (!matcher.find()) {
                log.warn("Could not parse XML tool call from failed_generation: {}", failedGeneration);
                return plainTextResponse(RECOVERY_FALLBACK);
            }

            String toolName = matcher.group(1);
            String argsJson = matcher.group(2);
            log.info("Recovered {} tool call: tool={}", providerName, toolName);

            return LlmResponse.builder()
                    .toolCalls(List.of(ToolCall.builder()
                            .id("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8))
                            .toolName(toolName)
                            .arguments(argsJson)
                            .build()))
                    .finishReason("tool_calls")
                    .build();

        } catch (JsonProcessingException e) {
            log.error("Failed to recover from tool_use_failed: {}", e.getMessage());
            return plainTextResponse(RECOVERY_FALLBACK);
        }
    }

    private static LlmResponse plainTextResponse(String message) {
        return LlmResponse.builder().content(message).finishReason("stop").build();
    }

    // ─── Streaming ────────────────────────────────────────────────────────────

    private final class StreamDecoder implements SseStreamDecoder {

        private final Map<Integer, ToolCallBuffer> toolCalls = new TreeMap<>();
        private String finishReason;
        private TokenUsage usage;
        private boolean finished;

        @Override
        public List<LlmChunk> decode(SseEvent event) {
            String data = event.data();
            if (data == null || data.isBlank()) return List.of();
            if (DONE_SENTINEL.equals(data.trim())) {
                finished = true;
                return List.of();
            }

            JsonNode frame;
            try {
                frame = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed {} stream frame: {}", providerName, JsonSupport.abbreviate(data));
                return List.of();
            }

            if (frame.has("error")) {
                throw new LlmApiException(providerName, 0, data);
            }

            TokenUsage frameUsage = parseUsage(frame);
            if (frameUsage != null) usage = frameUsage;

            JsonNode choice = frame.path("choices").path(0);
            if (choice.isMissingNode()) return List.of();

            String finish = textOrNull(choice.path("finish_reason"));
            if (finish != null) finishReason = finish;

            JsonNode delta = choice.path("delta");
            for (JsonNode fragment : delta.path("tool_calls")) {
                int index = fragment.path("index").asInt(toolCalls.size());
                ToolCallBuffer buffer = toolCalls.computeIfAbsent(index, i -> new ToolCallBuffer());
                String id = textOrNull(fragment.path("id"));
                if (id != null) buffer.id = id;
                JsonNode function = fragment.path("function");
                String name = textOrNull(function.path("name"));
                if (name != null) buffer.name = name;
                String arguments = textOrNull(function.path("arguments"));
                if (arguments != null) buffer.arguments.append(arguments);
            }

            String content = textOrNull(delta.path("content"));
            return content != null && !content.isEmpty() ? List.of(LlmChunk.text(content)) : List.of();
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public List<LlmChunk> finish() {
            List<ToolCall> calls = toolCalls.entrySet().stream()
                    .map(e -> e.getValue().build(e.getKey()))
                    .toList();
            if (calls.isEmpty() && finishReason == null && usage == null) {
                return List.of();
            }
            return List.of(LlmChunk.builder()
                    .toolCalls(calls.isEmpty() ? null : calls)
                    .finishReason(finishReason)
                    .usage(usage)
                    .build());
        }
    }

    private static final class ToolCallBuffer {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        ToolCall build(int index) {
            return ToolCall.builder()
                    .id(id != null ? id : "call_" + index)
                    .toolName(name)
                    .arguments(arguments.length() > 0 ? arguments.toString() : "{}")
                    .build();
        }
    }
}
