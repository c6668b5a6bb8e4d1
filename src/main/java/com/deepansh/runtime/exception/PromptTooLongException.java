package com.deepansh.runtime.exception;

import lombok.Getter;

@Getter
public class PromptTooLongException extends AgentException {

    private final int length;
    private final int maxLength;

    public PromptTooLongException(int length, int maxLength) {
        super("Prompt length " + length + " exceeds the maximum of " + maxLength + " characters");
        this.length = length;
        this.maxLength = maxLength;
    }
}
