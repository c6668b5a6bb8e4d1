package com.deepansh.runtime.api;

import com.deepansh.runtime.core.AgentSessionService;
import com.deepansh.runtime.model.AgentRequest;
import com.deepansh.runtime.model.AgentResponse;
import com.deepansh.runtime.observability.RunStateSnapshot;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Agent endpoints.
 *
 * POST /api/v1/agent/run     blocking turn, returns the FINAL response
 * POST /api/v1/agent/stream  text/event-stream, one event per response fragment
 * POST /api/v1/agent/resume  continues from the stored checkpoint, 404 when there is none
 * POST /api/v1/agent/cancel  cancels the in-flight turn
 * GET  /api/v1/agent/state   run state and active agent
 */
@RestController
@RequestMapping("/api/v1/agent")
@Slf4j
public class AgentController {

    private static final long SSE_TIMEOUT_MS = 15 * 60 * 1000; // 15 minutes

    private final AgentSessionService sessionService;
    private final TaskExecutor streamExecutor;

    public AgentController(AgentSessionService sessionService,
                           @Qualifier("streamExecutor") TaskExecutor streamExecutor) {
        this.sessionService = sessionService;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(@Valid @RequestBody AgentRequest request) {
        log.info("Agent run request [inputLength={}]", request.getInput().length());
        return ResponseEntity.ok(sessionService.run(request.getInput()));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody AgentRequest request) {
        log.info("Agent stream request [inputLength={}]", request.getInput().length());
        // validation and busy errors surface here, before the response is committed
        Stream<AgentResponse> responses = sessionService.stream(request.getInput());

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        emitter.onTimeout(() -> {
            log.warn("SSE stream timed out, cancelling run");
            sessionService.cancel();
        });
        streamExecutor.execute(() -> pump(responses, emitter));
        return emitter;
    }

    @PostMapping("/resume")
    public ResponseEntity<AgentResponse> resume() {
        return sessionService.resume()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled", sessionService.cancel()));
    }

    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> state() {
        RunStateSnapshot snapshot = sessionService.state();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", snapshot.running());
        body.put("currentStep", snapshot.currentStep());
        body.put("errorMessage", snapshot.errorMessage());
        body.put("updatedAt", snapshot.updatedAt().toString());
        body.put("activeAgent", sessionService.activeAgentName());
        return ResponseEntity.ok(body);
    }

    private void pump(Stream<AgentResponse> responses, SseEmitter emitter) {
        try (responses) {
            Iterator<AgentResponse> it = responses.iterator();
            while (it.hasNext()) {
                AgentResponse response = it.next();
                if (!send(emitter, eventName(response), response)) {
                    return;
                }
            }
            emitter.complete();
        } catch (RuntimeException e) {
            log.warn("Agent stream ended with error: {}", e.getMessage());
            // the response is already committed, so the error goes out as an event
            if (send(emitter, "error", Map.of("error", String.valueOf(e.getMessage()),
                    "kind", e.getClass().getSimpleName()))) {
                emitter.complete();
            }
        }
    }

    private static boolean send(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("SSE client went away ({}), abandoning stream", e.getMessage());
            return false;
        }
    }

    static String eventName(AgentResponse response) {
        return switch (response.getKind()) {
            case TEXT_DELTA -> "text_delta";
            case TOOL_CALLS -> "tool_calls";
            case USAGE -> "usage";
            case FINAL -> "final";
        };
    }
}
