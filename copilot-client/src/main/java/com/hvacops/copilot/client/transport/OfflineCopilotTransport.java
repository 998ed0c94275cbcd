package com.hvacops.copilot.client.transport;

import com.hvacops.copilot.client.mock.OfflineMockResponder;
import com.hvacops.copilot.client.model.ConversationHistory;
import com.hvacops.copilot.client.model.CopilotReply;
import com.hvacops.copilot.client.model.CopilotTurnRequest;
import com.hvacops.copilot.client.stream.DeltaListener;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers from {@link OfflineMockResponder}. Streaming replays the answer word by word through
 * the listener so callers consume both transports the same way.
 */
public class OfflineCopilotTransport implements CopilotTransport {

    private final OfflineMockResponder responder;

    public OfflineCopilotTransport(OfflineMockResponder responder) {
        this.responder = responder;
    }

    @Override
    public Mono<CopilotReply> send(String jobId, CopilotTurnRequest request) {
        return Mono.fromCallable(() -> responder.respond(request.message()));
    }

    @Override
    public Mono<CopilotReply> stream(String jobId, CopilotTurnRequest request, DeltaListener listener) {
        return Mono.fromCallable(() -> {
            CopilotReply reply = responder.respond(request.message());
            for (String delta : words(reply.answer())) {
                listener.onDelta(delta);
            }
            return reply;
        });
    }

    @Override
    public Mono<ConversationHistory> loadConversation(String jobId, String conversationId) {
        return Mono.just(ConversationHistory.empty());
    }

    static List<String> words(String answer) {
        String[] words = answer.split(" ");
        List<String> deltas = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            deltas.add(i < words.length - 1 ? words[i] + " " : words[i]);
        }
        return deltas;
    }
}
