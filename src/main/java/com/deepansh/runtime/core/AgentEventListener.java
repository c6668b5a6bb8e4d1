package com.deepansh.runtime.core;

/**
 * Optional observability hooks of an {@link AgentLoop}. All methods default to no-ops.
 * They are called on the run's thread; keep them fast.
 */
public interface AgentEventListener {

    AgentEventListener NOOP = new AgentEventListener() {};

    /** A tool threw or timed out. The run continues with the error text as the observation. */
    default void onToolError(String toolName, Throwable error) {
    }

    /** The run ended with an exception other than cancellation. */
    default void onAgentFailure(Throwable error) {
    }

    default void onWarning(String warning) {
    }
}
