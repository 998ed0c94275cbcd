package com.hvacops.copilot.service.memory;

import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.Evidence;

import java.util.List;

/**
 * A user question and the answer it produced, written together once orchestration succeeds.
 * A null {@code conversationId} starts a new conversation.
 */
public record CompletedExchange(String conversationId,
                                String tenantId,
                                String jobId,
                                String userId,
                                String userMessage,
                                String answer,
                                List<Citation> citations,
                                List<String> followUps,
                                List<Evidence> evidence,
                                String model,
                                String promptVersion) {

    public CompletedExchange {
        citations = citations == null ? List.of() : citations;
        followUps = followUps == null ? List.of() : followUps;
        evidence = evidence == null ? List.of() : evidence;
    }
}
