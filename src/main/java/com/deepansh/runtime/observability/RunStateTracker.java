package com.deepansh.runtime.observability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Observable state of the current agent run.
 *
 * Every transition publishes a fresh {@link RunStateSnapshot} to all subscribers,
 * synchronously on the calling thread. Consumers that only poll use {@link #snapshot()}.
 */
@Component
@Slf4j
public class RunStateTracker {

    private final List<Consumer<RunStateSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private volatile RunStateSnapshot current = RunStateSnapshot.idle();

    public void startRun() {
        publish(new RunStateSnapshot(true, "Initializing agent run...", null, Instant.now()));
    }

    public void updateStep(String step) {
        RunStateSnapshot prev = current;
        publish(new RunStateSnapshot(prev.running(), step, prev.errorMessage(), Instant.now()));
    }

    public void completeRun() {
        publish(new RunStateSnapshot(false, "Run completed", null, Instant.now()));
    }

    public void failRun(String errorMessage) {
        publish(new RunStateSnapshot(false, "Run failed", errorMessage, Instant.now()));
    }

    public void reset() {
        publish(RunStateSnapshot.idle());
    }

    public RunStateSnapshot snapshot() {
        return current;
    }

    /** Registers a listener; it does not receive the current value until the next transition. */
    public Subscription subscribe(Consumer<RunStateSnapshot> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void publish(RunStateSnapshot snapshot) {
        current = snapshot;
        log.debug("Run state [running={}, step={}]", snapshot.running(), snapshot.currentStep());
        for (Consumer<RunStateSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("Run state listener failed: {}", e.getMessage());
            }
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
