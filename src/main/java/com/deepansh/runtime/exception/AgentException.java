package com.deepansh.runtime.exception;

/**
 * Root of the runtime's unchecked exception hierarchy.
 * Anything thrown out of the agent loop or a provider adapter is one of these.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
