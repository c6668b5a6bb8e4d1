package com.deepansh.runtime.tool.impl;

import com.deepansh.runtime.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Returns its input unchanged. Lets a provider round-trip a tool call
 * without touching anything outside the process.
 */
@Component
public class EchoTool implements AgentTool<EchoTool.Args> {

    static final int MAX_REPEAT = 5;

    public record Args(String message, int repeat) {}

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Repeats the given message back verbatim. Only useful for checking that tool calls work.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of("type", "string", "description", "Text to send back"),
                        "repeat", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_REPEAT,
                                "description", "How many times to repeat the message, default 1"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(5);
    }

    @Override
    public Args parseArguments(Map<String, Object> raw) {
        Object message = raw.get("message");
        if (message == null) {
            throw new IllegalArgumentException("'message' is required");
        }
        Object repeat = raw.get("repeat");
        int times = 1;
        if (repeat instanceof Number n) {
            times = n.intValue();
        } else if (repeat != null) {
            try {
                times = Integer.parseInt(repeat.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'repeat' is not an integer: " + repeat);
            }
        }
        if (times < 1 || times > MAX_REPEAT) {
            throw new IllegalArgumentException("'repeat' must be between 1 and " + MAX_REPEAT);
        }
        return new Args(message.toString(), times);
    }

    @Override
    public String execute(Args args) {
        return "Echo: " + String.join(" ", Collections.nCopies(args.repeat(), args.message()));
    }
}
