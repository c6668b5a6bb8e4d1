package com.deepansh.runtime.exception;

/**
 * A turn is already in flight; the runtime handles one turn at a time.
 */
public class AgentBusyException extends AgentException {

    public AgentBusyException() {
        super("Another agent run is in progress");
    }
}
