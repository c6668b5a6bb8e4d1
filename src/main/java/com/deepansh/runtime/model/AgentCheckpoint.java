package com.deepansh.runtime.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable snapshot of an in-flight run, written at request and tool boundaries
 * so a run can resume after the process dies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentCheckpoint {

    private boolean running;
    private String currentStep;
    private int iterationCount;
    private String errorMessage;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
