package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Durable store behind {@link ConversationMemory} and the agent loop's checkpoints.
 * Only the memory manager and the agent loop call it; there is never more than one writer.
 */
public interface AgentPersistence {

    /**
     * Appends one message row. Role, content, tool call id, tool name and tool calls
     * are taken from the message.
     *
     * @param summary true for rows holding a compacted long-term summary
     */
    void saveMessage(Message message, boolean summary);

    /** Every stored row, oldest first. */
    List<StoredMessage> loadMessages();

    void clearMessages();

    /**
     * Keeps the newest {@code keepLimit} non-summary rows and deletes the older ones.
     * Summary rows are never touched.
     */
    void deleteOldMessages(int keepLimit);

    /** Replaces the stored checkpoint; there is at most one. */
    void saveCheckpoint(AgentCheckpoint checkpoint);

    Optional<AgentCheckpoint> loadCheckpoint();

    void clearCheckpoint();
}
