package com.deepansh.runtime.llm;

import com.deepansh.runtime.core.CancellationToken;
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
import com.deepansh.runtime.tool.ToolArgumentParser;
import com.deepansh.runtime.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StopWatch;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.deepansh.runtime.llm.JsonSupport.textOrNull;

/**
 * Anthropic Messages API client.
 *
 * Translation rules:
 * - system messages are hoisted into the top-level "system" field
 * - assistant tool calls become "tool_use" content blocks
 * - tool results become "tool_result" blocks inside a user message;
 *   consecutive results share one user message
 * - stop_reason "tool_use" is reported as the canonical "tool_calls"
 *
 * Streaming follows the typed event sequence message_start, content_block_start,
 * content_block_delta, message_delta, message_stop. Text deltas are emitted as they
 * arrive; tool input JSON fragments are buffered per block index and emitted once,
 * parsed, in the final aggregate chunk.
 */
@Slf4j
public class AnthropicClient implements LlmClient {

    static final String PROVIDER = "anthropic";
    private static final String DEFAULT_API_VERSION = "2023-06-01";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final ToolArgumentParser argumentParser;
    private final PooledHttpTransport transport;
    private final LlmRetryPolicy retryPolicy;
    private final RestClient restClient;

    public AnthropicClient(LlmProviderProperties props,
                           ObjectMapper objectMapper,
                           PooledHttpTransport transport,
                           LlmRetryPolicy retryPolicy) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.argumentParser = new ToolArgumentParser(objectMapper);
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.restClient = transport.restClientBuilder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("x-api-key", props.getApiKey())
                .defaultHeader("anthropic-version",
                        props.getApiVersion() != null ? props.getApiVersion() : DEFAULT_API_VERSION)
                .build();
    }

    @Override
    public String getProviderName() {
        return PROVIDER;
    }

    @Override
    public LlmResponse chat(List<Message> messages,
                            List<ToolDefinition> tools,
                            ChatOptions options,
                            CancellationToken token) {
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options, false));

        log.debug("Sending {} messages to {} [model={}]", messages.size(), PROVIDER, props.getModel());
        StopWatch watch = new StopWatch(PROVIDER);
        watch.start();
        try {
            String body = retryPolicy.execute(token, () -> restClient.post()
                    .uri("/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestJson)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw HttpErrors.fromResponse(PROVIDER, res);
                    })
                    .body(String.class));
            return parseResponse(JsonSupport.readTree(objectMapper, PROVIDER, body));
        } finally {
            watch.stop();
            log.debug("{} chat round-trip took {}ms", PROVIDER, watch.getTotalTimeMillis());
        }
    }

    @Override
    public Stream<LlmChunk> streamChat(List<Message> messages,
                                       List<ToolDefinition> tools,
                                       ChatOptions options,
                                       CancellationToken token) {
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options, true));

        log.debug("Streaming {} messages to {} [model={}]", messages.size(), PROVIDER, props.getModel());
        StreamingResponse response = retryPolicy.execute(token, () -> restClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(requestJson)
                .exchange((req, res) -> {
                    if (res.getStatusCode().isError()) {
                        try {
                            throw HttpErrors.fromResponse(PROVIDER, res);
                        } finally {
                            res.close();
                        }
                    }
                    return StreamingResponse.open(res);
                }, false));

        return SseChunkIterator.stream(PROVIDER,
                new SseEventReader(response.getBody(), token), new StreamDecoder(), token, response);
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
        body.put("max_tokens", opts.getMaxTokens() != null ? opts.getMaxTokens() : props.getMaxTokens());

        String system = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::getContent)
                .filter(c -> c != null && !c.isBlank())
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) body.put("system", system);

        body.put("messages", formatMessages(messages));
        body.put("temperature", opts.getTemperature() != null ? opts.getTemperature() : props.getTemperature());

        Double topP = opts.getTopP() != null ? opts.getTopP() : props.getTopP();
        if (topP != null) body.put("top_p", topP);

        List<String> stop = opts.getStop() != null ? opts.getStop() : props.getStop();
        if (stop != null && !stop.isEmpty()) body.put("stop_sequences", stop);

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toAnthropicSchema).toList());
        }
        if (stream) body.put("stream", true);
        return body;
    }

    private List<Map<String, Object>> formatMessages(List<Message> messages) {
        List<Map<String, Object>> formatted = new ArrayList<>();
        List<Map<String, Object>> pendingResults = null;

        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.system) continue;

            if (msg.getRole() == Message.Role.tool) {
                if (pendingResults == null) {
                    pendingResults = new ArrayList<>();
                    formatted.add(Map.of("role", "user", "content", pendingResults));
                }
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("type", "tool_result");
                result.put("tool_use_id", msg.getToolCallId());
                result.put("content", msg.getContent() != null ? msg.getContent() : "");
                pendingResults.add(result);
                continue;
            }
            pendingResults = null;

            if (msg.getRole() == Message.Role.assistant && msg.hasToolCalls()) {
                List<Map<String, Object>> blocks = new ArrayList<>();
                if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    blocks.add(Map.of("type", "text", "text", msg.getContent()));
                }
                for (ToolCall call : msg.getToolCalls()) {
                    Map<String, Object> block = new LinkedHashMap<>();
                    block.put("type", "tool_use");
                    block.put("id", call.getId());
                    block.put("name", call.getToolName());
                    block.put("input", argumentParser.parse(call.getArguments()));
                    blocks.add(block);
                }
                formatted.add(Map.of("role", "assistant", "content", blocks));
            } else {
                formatted.add(Map.of(
                        "role", msg.getRole() == Message.Role.assistant ? "assistant" : "user",
                        "content", msg.getContent() != null ? msg.getContent() : ""));
            }
        }
        return formatted;
    }

    // ─── Response ─────────────────────────────────────────────────────────────

    private LlmResponse parseResponse(JsonNode response) {
        List<String> texts = new ArrayList<>();
        List<ToolCall> toolCalls = new ArrayList<>();

        for (JsonNode block : response.path("content")) {
            String type = textOrNull(block.path("type"));
            if ("text".equals(type)) {
                texts.add(block.path("text").asText(""));
            } else if ("tool_use".equals(type)) {
                JsonNode input = block.path("input");
                toolCalls.add(ToolCall.builder()
                        .id(textOrNull(block.path("id")))
                        .toolName(textOrNull(block.path("name")))
                        .arguments(input.isObject() ? input.toString() : "{}")
                        .build());
            }
        }

        String stopReason = mapStopReason(textOrNull(response.path("stop_reason")));
        TokenUsage usage = JsonSupport.usage(response.get("usage"), "input_tokens", "output_tokens", null);
        log.debug("{} stop_reason: {} usage: {}", PROVIDER, stopReason, usage);

        return LlmResponse.builder()
                .content(texts.isEmpty() ? null : String.join("\n", texts))
                .toolCalls(toolCalls)
                .finishReason(stopReason)
                .usage(usage)
                .build();
    }

    static String mapStopReason(String stopReason) {
        return "tool_use".equals(stopReason) ? "tool_calls" : stopReason;
    }

    // ─── Streaming ────────────────────────────────────────────────────────────

    private final class StreamDecoder implements SseStreamDecoder {

        private final Map<Integer, ToolUseBlock> toolBlocks = new TreeMap<>();
        private int inputTokens;
        private int outputTokens;
        private boolean usageSeen;
        private String stopReason;
        private boolean finished;

        @Override
        public List<LlmChunk> decode(SseEvent event) {
            JsonNode data;
            try {
                data = objectMapper.readTree(event.data());
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed {} stream frame [event={}]: {}",
                        PROVIDER, event.event(), JsonSupport.abbreviate(event.data()));
                return List.of();
            }

            String type = textOrNull(data.path("type"));
            if (type == null) type = event.event();
            if (type == null) return List.of();

            switch (type) {
                case "message_start" -> {
                    JsonNode usage = data.path("message").path("usage");
                    if (usage.isObject()) {
                        usageSeen = true;
                        inputTokens = usage.path("input_tokens").asInt(0);
                        outputTokens = usage.path("output_tokens").asInt(outputTokens);
                    }
                }
                case "content_block_start" -> {
                    JsonNode block = data.path("content_block");
                    if ("tool_use".equals(textOrNull(block.path("type")))) {
                        toolBlocks.put(data.path("index").asInt(),
                                new ToolUseBlock(textOrNull(block.path("id")), textOrNull(block.path("name"))));
                    }
                }
                case "content_block_delta" -> {
                    JsonNode delta = data.path("delta");
                    String deltaType = textOrNull(delta.path("type"));
                    if ("text_delta".equals(deltaType)) {
                        String text = delta.path("text").asText("");
                        if (!text.isEmpty()) return List.of(LlmChunk.text(text));
                    } else if ("input_json_delta".equals(deltaType)) {
                        int index = data.path("index").asInt();
                        toolBlocks.computeIfAbsent(index, i -> new ToolUseBlock(null, null))
                                .partialJson.append(delta.path("partial_json").asText(""));
                    }
                }
                case "message_delta" -> {
                    String reason = textOrNull(data.path("delta").path("stop_reason"));
                    if (reason != null) stopReason = reason;
                    JsonNode usage = data.path("usage");
                    if (usage.isObject()) {
                        usageSeen = true;
                        outputTokens = usage.path("output_tokens").asInt(outputTokens);
                        if (usage.has("input_tokens")) inputTokens = usage.path("input_tokens").asInt(inputTokens);
                    }
                }
                case "message_stop" -> finished = true;
                case "error" -> throw new LlmApiException(PROVIDER, 0, event.data());
                default -> {
                    // ping, content_block_stop
                }
            }
            return List.of();
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public List<LlmChunk> finish() {
            List<ToolCall> calls = toolBlocks.entrySet().stream()
                    .map(e -> e.getValue().toToolCall(e.getKey()))
                    .toList();
            return List.of(LlmChunk.builder()
                    .toolCalls(calls.isEmpty() ? null : calls)
                    .finishReason(mapStopReason(stopReason))
                    .usage(usageSeen ? TokenUsage.of(inputTokens, outputTokens) : null)
                    .build());
        }

        private String normaliseInput(String json) {
            if (json.isBlank()) return "{}";
            try {
                JsonNode parsed = objectMapper.readTree(json);
                return parsed != null && parsed.isObject() ? parsed.toString() : "{}";
            } catch (JsonProcessingException e) {
                log.warn("{} tool input is not valid JSON, using empty object: {}", PROVIDER, JsonSupport.abbreviate(json));
                return "{}";
            }
        }

        private final class ToolUseBlock {
            private final String id;
            private final String name;
            private final StringBuilder partialJson = new StringBuilder();

            ToolUseBlock(String id, String name) {
                this.id = id;
                this.name = name;
            }

            ToolCall toToolCall(int index) {
                return ToolCall.builder()
                        .id(id != null ? id : "toolu_" + index)
                        .toolName(name)
                        .arguments(normaliseInput(partialJson.toString()))
                        .build();
            }
        }
    }
}
