package com.hvacops.copilot.service;

import com.hvacops.copilot.model.ConversationHistoryResponse;
import com.hvacops.copilot.model.CopilotChatResponse;
import com.hvacops.copilot.security.RequestIdentity;
import reactor.core.publisher.Flux;

public interface CopilotChatService {

    CopilotChatResponse chat(ChatCommand command);

    /**
     * JSON payloads for the event stream: {@code {"delta":...}} records, then the terminal reply,
     * or a single {@code {"error":...}} record when the request fails.
     */
    Flux<String> streamChat(ChatCommand command);

    ConversationHistoryResponse conversation(RequestIdentity identity, String jobId, String conversationId);
}
