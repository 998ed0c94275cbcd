package com.hvacops.copilot.persistence.repository;

import com.hvacops.copilot.persistence.entity.CopilotMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CopilotMessageRepository extends JpaRepository<CopilotMessageEntity, Long> {

    @Query("select coalesce(max(m.sequence), -1) from CopilotMessageEntity m where m.conversationId = :conversationId")
    int findMaxSequence(@Param("conversationId") String conversationId);

    List<CopilotMessageEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    List<CopilotMessageEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);
}
