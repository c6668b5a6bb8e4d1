package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.Message;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One conversation message in PostgreSQL.
 *
 * Tool calls of an assistant turn are stored as a JSON array in tool_calls_json
 * rather than a join table; they are only ever read back whole.
 */
@Entity
@Table(
    name = "agent_chat_messages",
    indexes = {
        @Index(name = "idx_chat_summary", columnList = "summary")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Message.Role role;

    @Column(columnDefinition = "TEXT")
    private String content;

    private boolean summary;

    private String toolCallId;

    private String toolName;

    @Column(columnDefinition = "TEXT")
    private String toolCallsJson;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
