package com.hvacops.copilot.service.memory;

import com.hvacops.copilot.model.ChatMessage;

import java.util.List;
import java.util.Optional;

public interface ConversationStore {

    /**
     * Returns the id when the conversation exists for this tenant and job, empty otherwise.
     */
    Optional<String> findConversation(String tenantId, String jobId, String conversationId);

    Optional<String> findLatestConversation(String tenantId, String jobId, String userId);

    /**
     * Up to {@code limit} most recent turns, oldest first.
     */
    List<ChatMessage> recentHistory(String conversationId, int limit);

    List<StoredTurn> turns(String conversationId);

    /**
     * Persists both turns of the exchange and returns the conversation id they were stored under.
     */
    String recordExchange(CompletedExchange exchange);
}
