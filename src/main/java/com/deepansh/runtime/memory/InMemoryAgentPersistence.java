package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Process-local store. Used for the "memory" persistence mode and in tests;
 * everything is lost on restart.
 */
@Slf4j
public class InMemoryAgentPersistence implements AgentPersistence {

    private final List<StoredMessage> rows = new ArrayList<>();
    private long nextId = 1;
    private AgentCheckpoint checkpoint;

    @Override
    public synchronized void saveMessage(Message message, boolean summary) {
        rows.add(new StoredMessage(nextId++, message, summary, Instant.now()));
    }

    @Override
    public synchronized List<StoredMessage> loadMessages() {
        return List.copyOf(rows);
    }

    @Override
    public synchronized void clearMessages() {
        rows.clear();
    }

    @Override
    public synchronized void deleteOldMessages(int keepLimit) {
        long total = rows.stream().filter(r -> !r.summary()).count();
        long toDelete = total - Math.max(0, keepLimit);
        if (toDelete <= 0) return;

        int removed = 0;
        Iterator<StoredMessage> it = rows.iterator();
        while (it.hasNext() && removed < toDelete) {
            if (!it.next().summary()) {
                it.remove();
                removed++;
            }
        }
        log.debug("Pruned {} stored messages [keep={}]", removed, keepLimit);
    }

    @Override
    public synchronized void saveCheckpoint(AgentCheckpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    @Override
    public synchronized Optional<AgentCheckpoint> loadCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }

    @Override
    public synchronized void clearCheckpoint() {
        checkpoint = null;
    }
}
