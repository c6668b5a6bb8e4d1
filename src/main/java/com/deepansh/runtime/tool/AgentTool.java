package com.deepansh.runtime.tool;

import java.time.Duration;
import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows exactly how to invoke the tool.
 *
 * {@link #execute(Object)} may throw. The registry turns any exception or timeout
 * into an error observation, so the agent loop keeps going and the model can
 * recover or try another approach.
 *
 * @param <A> the typed argument value produced by {@link #parseArguments(Map)}
 */
public interface AgentTool<A> {

    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters:
     * {@code type: object}, {@code properties}, {@code required}.
     */
    Map<String, Object> getInputSchema();

    /** Static confirmation policy. */
    default boolean requiresConfirmation() {
        return false;
    }

    /**
     * Per-call confirmation policy. Defaults to the static flag; override to
     * assess risk from the actual arguments.
     */
    default boolean requiresConfirmation(A arguments) {
        return requiresConfirmation();
    }

    default Duration getTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Converts the decoded JSON object into the tool's argument type.
     * Throw {@link IllegalArgumentException} for missing or invalid fields.
     */
    A parseArguments(Map<String, Object> raw);

    /** Execute the tool and return a string observation fed back to the model. */
    String execute(A arguments) throws Exception;
}
