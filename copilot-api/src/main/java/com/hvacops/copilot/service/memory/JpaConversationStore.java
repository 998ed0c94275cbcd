package com.hvacops.copilot.service.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.model.ChatRole;
import com.hvacops.copilot.model.Evidence;
import com.hvacops.copilot.persistence.entity.CopilotConversationEntity;
import com.hvacops.copilot.persistence.entity.CopilotMessageEntity;
import com.hvacops.copilot.persistence.repository.CopilotConversationRepository;
import com.hvacops.copilot.persistence.repository.CopilotMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);
    static final String SOURCE_APP = "app";

    private final CopilotConversationRepository conversationRepository;
    private final CopilotMessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    public JpaConversationStore(CopilotConversationRepository conversationRepository,
                                CopilotMessageRepository messageRepository,
                                ObjectMapper objectMapper) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findConversation(String tenantId, String jobId, String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        return conversationRepository.findByIdAndTenantIdAndJobId(conversationId, tenantId, jobId)
                .map(CopilotConversationEntity::getId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findLatestConversation(String tenantId, String jobId, String userId) {
        return conversationRepository.findFirstByTenantIdAndJobIdAndUserIdOrderByUpdatedAtDesc(tenantId, jobId, userId)
                .map(CopilotConversationEntity::getId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> recentHistory(String conversationId, int limit) {
        if (conversationId == null || limit <= 0) {
            return List.of();
        }
        List<CopilotMessageEntity> newestFirst = new ArrayList<>(
                messageRepository.findByConversationIdOrderBySequenceDesc(conversationId, PageRequest.of(0, limit)));
        Collections.reverse(newestFirst);
        return newestFirst.stream()
                .map(entity -> new ChatMessage(entity.getRole(), entity.getContent()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredTurn> turns(String conversationId) {
        return messageRepository.findByConversationIdOrderBySequenceAsc(conversationId).stream()
                .map(entity -> new StoredTurn(entity.getRole(), entity.getContent(), entity.getCreatedAt(),
                        entity.getMetadataJson()))
                .toList();
    }

    @Override
    public String recordExchange(CompletedExchange exchange) {
        CopilotConversationEntity conversation = ensureConversation(exchange);
        int sequence = messageRepository.findMaxSequence(conversation.getId());

        Map<String, Object> userMetadata = Map.of("type", "user_message");
        messageRepository.save(message(exchange, conversation.getId(), ChatRole.USER,
                exchange.userMessage(), ++sequence, userMetadata));

        Map<String, Object> assistantMetadata = new LinkedHashMap<>();
        assistantMetadata.put("type", "assistant_message");
        assistantMetadata.put("citations", exchange.citations());
        assistantMetadata.put("follow_ups", exchange.followUps());
        assistantMetadata.put("evidence", exchange.evidence().stream().map(Evidence::docId).toList());
        messageRepository.save(message(exchange, conversation.getId(), ChatRole.ASSISTANT,
                exchange.answer(), ++sequence, assistantMetadata));

        conversation.touch();
        conversationRepository.save(conversation);
        log.debug("Stored exchange in conversation {} for job {}", conversation.getId(), exchange.jobId());
        return conversation.getId();
    }

    private CopilotConversationEntity ensureConversation(CompletedExchange exchange) {
        if (exchange.conversationId() != null) {
            Optional<CopilotConversationEntity> existing = conversationRepository.findByIdAndTenantIdAndJobId(
                    exchange.conversationId(), exchange.tenantId(), exchange.jobId());
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        return conversationRepository.save(new CopilotConversationEntity(
                UUID.randomUUID().toString(), exchange.tenantId(), exchange.jobId(), exchange.userId()));
    }

    private CopilotMessageEntity message(CompletedExchange exchange,
                                         String conversationId,
                                         ChatRole role,
                                         String content,
                                         int sequence,
                                         Map<String, Object> metadata) {
        CopilotMessageEntity entity = new CopilotMessageEntity(
                conversationId,
                exchange.tenantId(),
                exchange.jobId(),
                exchange.userId(),
                role,
                content,
                sequence
        );
        entity.setSource(SOURCE_APP);
        entity.setModel(exchange.model());
        entity.setPromptVersion(exchange.promptVersion());
        entity.setMetadataJson(toJson(metadata));
        entity.setContentHash(sha256(content));
        return entity;
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message metadata", e);
        }
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
