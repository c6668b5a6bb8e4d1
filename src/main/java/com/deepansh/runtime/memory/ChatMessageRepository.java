package com.deepansh.runtime.memory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    List<ChatMessageEntity> findAllByOrderByIdAsc();

    /** Newest first, used when pruning. */
    List<ChatMessageEntity> findBySummaryFalseOrderByIdDesc();
}
