package com.deepansh.runtime.memory;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The single run checkpoint. Always stored under {@link #SINGLETON_ID}, so saving overwrites.
 */
@Entity
@Table(name = "agent_checkpoints")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    private boolean running;

    @Column(length = 1000)
    private String currentStep;

    private int iterationCount;

    @Column(length = 2000)
    private String errorMessage;

    private Instant timestamp;
}
