package com.hvacops.copilot.client.transport;

import com.hvacops.copilot.client.model.ConversationHistory;
import com.hvacops.copilot.client.model.CopilotReply;
import com.hvacops.copilot.client.model.CopilotTurnRequest;
import com.hvacops.copilot.client.stream.DeltaListener;
import reactor.core.publisher.Mono;

public interface CopilotTransport {

    Mono<CopilotReply> send(String jobId, CopilotTurnRequest request);

    /**
     * Requests a streamed answer. Deltas reach {@code listener} in arrival order before the
     * returned Mono emits the terminal reply.
     */
    Mono<CopilotReply> stream(String jobId, CopilotTurnRequest request, DeltaListener listener);

    Mono<ConversationHistory> loadConversation(String jobId, String conversationId);
}
