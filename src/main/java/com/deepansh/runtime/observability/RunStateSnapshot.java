package com.deepansh.runtime.observability;

import java.time.Instant;

/**
 * Immutable view of the run state at one point in time.
 */
public record RunStateSnapshot(boolean running, String currentStep, String errorMessage, Instant updatedAt) {

    public static RunStateSnapshot idle() {
        return new RunStateSnapshot(false, null, null, Instant.now());
    }
}
