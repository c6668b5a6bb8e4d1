package com.deepansh.runtime.core;

import com.deepansh.runtime.exception.AgentBusyException;
import com.deepansh.runtime.memory.AgentPersistence;
import com.deepansh.runtime.memory.ConversationMemory;
import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.AgentResponse;
import com.deepansh.runtime.observability.RunStateSnapshot;
import com.deepansh.runtime.observability.RunStateTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Entry point for the HTTP layer. Memory is shared by every agent, so only one turn
 * may run at a time; the in-flight turn's token is kept here so it can be cancelled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AgentSessionService {

    private final AgentCoordinator coordinator;
    private final ConversationMemory memory;
    private final RunStateTracker runState;

    private final AtomicReference<CancellationToken> inFlight = new AtomicReference<>();

    public AgentResponse run(String input) {
        CancellationToken token = acquire();
        try {
            return coordinator.run(input, token);
        } finally {
            release(token);
        }
    }

    /** The turn stays in flight until the returned stream is closed. */
    public Stream<AgentResponse> stream(String input) {
        CancellationToken token = acquire();
        try {
            return coordinator.runStreaming(input, token).onClose(() -> release(token));
        } catch (RuntimeException e) {
            release(token);
            throw e;
        }
    }

    /** Empty when there is no stored checkpoint to resume from. */
    public Optional<AgentResponse> resume() {
        Optional<AgentCheckpoint> checkpoint = loadCheckpoint();
        if (checkpoint.isEmpty()) {
            return Optional.empty();
        }
        CancellationToken token = acquire();
        try {
            return Optional.of(coordinator.resume(checkpoint.get(), token));
        } finally {
            release(token);
        }
    }

    /** @return false when nothing was running */
    public boolean cancel() {
        CancellationToken token = inFlight.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for the in-flight run [agent={}]", activeAgentName());
        return true;
    }

    public RunStateSnapshot state() {
        return runState.snapshot();
    }

    public String activeAgentName() {
        return coordinator.getActiveAgent().getName();
    }

    private Optional<AgentCheckpoint> loadCheckpoint() {
        AgentPersistence persistence = memory.getPersistence();
        return persistence != null ? persistence.loadCheckpoint() : Optional.empty();
    }

    private CancellationToken acquire() {
        CancellationToken token = new CancellationToken();
        if (!inFlight.compareAndSet(null, token)) {
            throw new AgentBusyException();
        }
        return token;
    }

    private void release(CancellationToken token) {
        inFlight.compareAndSet(token, null);
    }
}
