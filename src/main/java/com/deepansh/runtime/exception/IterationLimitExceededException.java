package com.deepansh.runtime.exception;

import lombok.Getter;

@Getter
public class IterationLimitExceededException extends AgentException {

    private final int maxIterations;

    public IterationLimitExceededException(int maxIterations) {
        super("Agent exceeded the maximum of " + maxIterations + " iterations");
        this.maxIterations = maxIterations;
    }
}
