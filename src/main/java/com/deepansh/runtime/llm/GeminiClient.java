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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.deepansh.runtime.llm.JsonSupport.textOrNull;

/**
 * Google Gemini generateContent client.
 *
 * Translation rules:
 * - system messages are hoisted into "systemInstruction"
 * - role "assistant" is sent as "model"
 * - tool results become a user turn of functionResponse parts keyed by function name
 * - Gemini has no call ids; ids are derived from the function name
 *
 * Streamed frames (streamGenerateContent?alt=sse) carry whole parts rather than deltas.
 * Each text part is surfaced as a text chunk and each frame's function calls as one
 * tool-call chunk. Frames with usage metadata but no candidates become usage-only chunks.
 */
@Slf4j
public class GeminiClient implements LlmClient {

    static final String PROVIDER = "gemini";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final ToolArgumentParser argumentParser;
    private final PooledHttpTransport transport;
    private final LlmRetryPolicy retryPolicy;
    private final RestClient restClient;

    public GeminiClient(LlmProviderProperties props,
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
                .defaultHeader("x-goog-api-key", props.getApiKey())
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
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options));

        log.debug("Sending {} messages to {} [model={}]", messages.size(), PROVIDER, props.getModel());
        StopWatch watch = new StopWatch(PROVIDER);
        watch.start();
        try {
            String body = retryPolicy.execute(token, () -> restClient.post()
                    .uri("/models/{model}:generateContent", props.getModel())
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
        String requestJson = JsonSupport.toJson(objectMapper, buildRequestBody(messages, tools, options));

        log.debug("Streaming {} messages to {} [model={}]", messages.size(), PROVIDER, props.getModel());
        StreamingResponse response = retryPolicy.execute(token, () -> restClient.post()
                .uri("/models/{model}:streamGenerateContent?alt=sse", props.getModel())
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
                                                 ChatOptions options) {
        ChatOptions opts = options != null ? options : ChatOptions.defaults();

        Map<String, Object> body = new LinkedHashMap<>();

        String system = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::getContent)
                .filter(c -> c != null && !c.isBlank())
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        }

        body.put("contents", formatContents(messages));

        if (tools != null && !tools.isEmpty()) {
            List<Map<String, Object>> declarations = tools.stream().map(ToolDefinition::toGeminiDeclaration).toList();
            body.put("tools", List.of(Map.of("functionDeclarations", declarations)));
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", opts.getMaxTokens() != null ? opts.getMaxTokens() : props.getMaxTokens());
        generationConfig.put("temperature", opts.getTemperature() != null ? opts.getTemperature() : props.getTemperature());
        Double topP = opts.getTopP() != null ? opts.getTopP() : props.getTopP();
        if (topP != null) generationConfig.put("topP", topP);
        List<String> stop = opts.getStop() != null ? opts.getStop() : props.getStop();
        if (stop != null && !stop.isEmpty()) generationConfig.put("stopSequences", stop);
        body.put("generationConfig", generationConfig);

        return body;
    }

    private List<Map<String, Object>> formatContents(List<Message> messages) {
        // function responses are keyed by name, so remember which name each call id belonged to
        Map<String, String> callNames = new HashMap<>();
        List<Map<String, Object>> contents = new ArrayList<>();
        List<Map<String, Object>> pendingResponses = null;

        for (Message msg : messages) {
            switch (msg.getRole()) {
                case system -> {
                    // hoisted into systemInstruction
                }
                case tool -> {
                    if (pendingResponses == null) {
                        pendingResponses = new ArrayList<>();
                        contents.add(Map.of("role", "user", "parts", pendingResponses));
                    }
                    String name = msg.getName() != null ? msg.getName()
                            : callNames.getOrDefault(msg.getToolCallId(), msg.getToolCallId());
                    Map<String, Object> functionResponse = new LinkedHashMap<>();
                    functionResponse.put("name", name);
                    functionResponse.put("response", Map.of("result", msg.getContent() != null ? msg.getContent() : ""));
                    pendingResponses.add(Map.of("functionResponse", functionResponse));
                }
                case assistant -> {
                    pendingResponses = null;
                    List<Map<String, Object>> parts = new ArrayList<>();
                    if (msg.getContent() != null && !msg.getContent().isEmpty()) {
                        parts.add(Map.of("text", msg.getContent()));
                    }
                    if (msg.hasToolCalls()) {
                        for (ToolCall call : msg.getToolCalls()) {
                            callNames.put(call.getId(), call.getToolName());
                            Map<String, Object> functionCall = new LinkedHashMap<>();
                            functionCall.put("name", call.getToolName());
                            functionCall.put("args", argumentParser.parse(call.getArguments()));
                            parts.add(Map.of("functionCall", functionCall));
                        }
                    }
                    if (!parts.isEmpty()) {
                        contents.add(Map.of("role", "model", "parts", parts));
                    }
                }
                case user -> {
                    pendingResponses = null;
                    contents.add(Map.of("role", "user",
                            "parts", List.of(Map.of("text", msg.getContent() != null ? msg.getContent() : ""))));
                }
            }
        }
        return contents;
    }

    // ─── Response ─────────────────────────────────────────────────────────────

    private LlmResponse parseResponse(JsonNode response) {
        TokenUsage usage = parseUsage(response);
        JsonNode candidates = response.path("candidates");

        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = textOrNull(response.path("promptFeedback").path("blockReason"));
            if (blockReason != null) {
                log.warn("{} blocked the prompt: {}", PROVIDER, blockReason);
            }
            return LlmResponse.builder()
                    .finishReason(blockReason != null ? blockReason.toLowerCase(Locale.ROOT) : "stop")
                    .usage(usage)
                    .build();
        }

        JsonNode candidate = candidates.get(0);
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        collectParts(candidate, text, toolCalls, new HashMap<>());

        String finishReason = mapFinishReason(textOrNull(candidate.path("finishReason")), !toolCalls.isEmpty());
        log.debug("{} finishReason: {} usage: {}", PROVIDER, finishReason, usage);

        return LlmResponse.builder()
                .content(text.length() > 0 ? text.toString() : null)
                .toolCalls(toolCalls)
                .finishReason(finishReason)
                .usage(usage)
                .build();
    }

    private void collectParts(JsonNode candidate,
                              StringBuilder text,
                              List<ToolCall> toolCalls,
                              Map<String, Integer> idCounters) {
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("text")) {
                text.append(part.path("text").asText(""));
            } else if (part.has("functionCall")) {
                JsonNode call = part.path("functionCall");
                String name = textOrNull(call.path("name"));
                JsonNode args = call.path("args");
                toolCalls.add(ToolCall.builder()
                        .id(deriveId(name, idCounters))
                        .toolName(name)
                        .arguments(args.isObject() ? args.toString() : "{}")
                        .build());
            }
        }
    }

    /** The function name, suffixed when the same function is called more than once in a turn. */
    private static String deriveId(String name, Map<String, Integer> idCounters) {
        int seen = idCounters.merge(name, 1, Integer::sum);
        return seen == 1 ? name : name + "-" + seen;
    }

    private static TokenUsage parseUsage(JsonNode node) {
        return JsonSupport.usage(node.get("usageMetadata"),
                "promptTokenCount", "candidatesTokenCount", "totalTokenCount");
    }

    static String mapFinishReason(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls) return "tool_calls";
        if (finishReason == null) return null;
        return "STOP".equals(finishReason) ? "stop" : finishReason.toLowerCase(Locale.ROOT);
    }

    // ─── Streaming ────────────────────────────────────────────────────────────

    private final class StreamDecoder implements SseStreamDecoder {

        private final Map<String, Integer> idCounters = new HashMap<>();
        private boolean toolCallsSeen;

        @Override
        public List<LlmChunk> decode(SseEvent event) {
            JsonNode frame;
            try {
                frame = objectMapper.readTree(event.data());
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed {} stream frame: {}", PROVIDER, JsonSupport.abbreviate(event.data()));
                return List.of();
            }
            if (frame == null || !frame.isObject()) {
                return List.of();
            }
            if (frame.has("error")) {
                throw new LlmApiException(PROVIDER, frame.path("error").path("code").asInt(0), event.data());
            }

            List<LlmChunk> chunks = new ArrayList<>();
            TokenUsage usage = parseUsage(frame);
            JsonNode candidate = frame.path("candidates").path(0);

            String finishReason = null;
            if (!candidate.isMissingNode()) {
                StringBuilder text = new StringBuilder();
                List<ToolCall> toolCalls = new ArrayList<>();
                collectParts(candidate, text, toolCalls, idCounters);

                if (text.length() > 0) {
                    chunks.add(LlmChunk.text(text.toString()));
                }
                if (!toolCalls.isEmpty()) {
                    toolCallsSeen = true;
                    chunks.add(LlmChunk.toolCalls(toolCalls));
                }
                String raw = textOrNull(candidate.path("finishReason"));
                if (raw != null) {
                    finishReason = mapFinishReason(raw, toolCallsSeen);
                }
            }

            if (finishReason != null || usage != null) {
                chunks.add(LlmChunk.tail(finishReason, usage));
            }
            return chunks;
        }

        @Override
        public boolean isFinished() {
            return false;
        }

        @Override
        public List<LlmChunk> finish() {
            return List.of();
        }
    }
}
