package com.hvacops.copilot.persistence.repository;

import com.hvacops.copilot.persistence.entity.CopilotConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CopilotConversationRepository extends JpaRepository<CopilotConversationEntity, String> {

    Optional<CopilotConversationEntity> findByIdAndTenantIdAndJobId(String id, String tenantId, String jobId);

    Optional<CopilotConversationEntity> findFirstByTenantIdAndJobIdAndUserIdOrderByUpdatedAtDesc(String tenantId,
                                                                                                 String jobId,
                                                                                                 String userId);
}
