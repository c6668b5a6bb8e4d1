package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed store via Spring Data JPA.
 */
@Slf4j
@RequiredArgsConstructor
@Transactional
public class JpaAgentPersistence implements AgentPersistence {

    private static final TypeReference<List<ToolCall>> TOOL_CALLS = new TypeReference<>() {};

    private final ChatMessageRepository messageRepository;
    private final CheckpointRepository checkpointRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void saveMessage(Message message, boolean summary) {
        messageRepository.save(ChatMessageEntity.builder()
                .role(message.getRole())
                .content(message.getContent())
                .summary(summary)
                .toolCallId(message.getToolCallId())
                .toolName(message.getName())
                .toolCallsJson(message.hasToolCalls() ? writeToolCalls(message.getToolCalls()) : null)
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredMessage> loadMessages() {
        return messageRepository.findAllByOrderByIdAsc().stream()
                .map(this::toStored)
                .toList();
    }

    @Override
    public void clearMessages() {
        messageRepository.deleteAllInBatch();
        log.info("Cleared stored conversation messages");
    }

    @Override
    public void deleteOldMessages(int keepLimit) {
        List<ChatMessageEntity> newestFirst = messageRepository.findBySummaryFalseOrderByIdDesc();
        int keep = Math.max(0, keepLimit);
        if (newestFirst.size() <= keep) return;

        List<ChatMessageEntity> stale = newestFirst.subList(keep, newestFirst.size());
        messageRepository.deleteAll(stale);
        log.debug("Pruned {} stored messages [keep={}]", stale.size(), keep);
    }

    @Override
    public void saveCheckpoint(AgentCheckpoint checkpoint) {
        checkpointRepository.save(CheckpointEntity.builder()
                .id(CheckpointEntity.SINGLETON_ID)
                .running(checkpoint.isRunning())
                .currentStep(checkpoint.getCurrentStep())
                .iterationCount(checkpoint.getIterationCount())
                .errorMessage(checkpoint.getErrorMessage())
                .timestamp(checkpoint.getTimestamp())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AgentCheckpoint> loadCheckpoint() {
        return checkpointRepository.findById(CheckpointEntity.SINGLETON_ID)
                .map(e -> AgentCheckpoint.builder()
                        .running(e.isRunning())
                        .currentStep(e.getCurrentStep())
                        .iterationCount(e.getIterationCount())
                        .errorMessage(e.getErrorMessage())
                        .timestamp(e.getTimestamp())
                        .build());
    }

    @Override
    public void clearCheckpoint() {
        if (checkpointRepository.existsById(CheckpointEntity.SINGLETON_ID)) {
            checkpointRepository.deleteById(CheckpointEntity.SINGLETON_ID);
        }
    }

    private StoredMessage toStored(ChatMessageEntity e) {
        Message message = Message.builder()
                .role(e.getRole())
                .content(e.getContent())
                .toolCallId(e.getToolCallId())
                .name(e.getToolName())
                .toolCalls(e.getToolCallsJson() != null ? readToolCalls(e) : null)
                .build();
        return new StoredMessage(e.getId(), message, e.isSummary(), e.getCreatedAt());
    }

    private String writeToolCalls(List<ToolCall> toolCalls) {
        try {
            return objectMapper.writeValueAsString(toolCalls);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool calls", e);
        }
    }

    private List<ToolCall> readToolCalls(ChatMessageEntity e) {
        try {
            return objectMapper.readValue(e.getToolCallsJson(), TOOL_CALLS);
        } catch (JsonProcessingException ex) {
            log.warn("Dropping unreadable tool calls on stored message [id={}]: {}", e.getId(), ex.getMessage());
            return null;
        }
    }
}
