package com.hvacops.copilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.ConversationHistoryResponse;
import com.hvacops.copilot.model.CopilotChatResponse;
import com.hvacops.copilot.model.CopilotConfig;
import com.hvacops.copilot.model.CopilotRequest;
import com.hvacops.copilot.model.ParsedResponse;
import com.hvacops.copilot.security.RequestIdentity;
import com.hvacops.copilot.service.context.JobContext;
import com.hvacops.copilot.service.context.JobContextProvider;
import com.hvacops.copilot.service.memory.CompletedExchange;
import com.hvacops.copilot.service.memory.ConversationStore;
import com.hvacops.copilot.service.orchestration.CopilotOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DefaultCopilotChatService implements CopilotChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultCopilotChatService.class);
    static final String EMPTY_ANSWER = "Information not available in the job history.";

    private final CopilotOrchestrator orchestrator;
    private final JobContextProvider contextProvider;
    private final ConversationStore conversationStore;
    private final CitationNormalizer citationNormalizer;
    private final CopilotConfig config;
    private final ObjectMapper objectMapper;

    public DefaultCopilotChatService(CopilotOrchestrator orchestrator,
                                     JobContextProvider contextProvider,
                                     ConversationStore conversationStore,
                                     CitationNormalizer citationNormalizer,
                                     CopilotConfig config,
                                     ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.contextProvider = contextProvider;
        this.conversationStore = conversationStore;
        this.citationNormalizer = citationNormalizer;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public CopilotChatResponse chat(ChatCommand command) {
        RequestIdentity identity = command.identity();
        String conversationId = conversationStore
                .findConversation(identity.tenantId(), command.jobId(), command.conversationId())
                .orElse(null);
        if (command.conversationId() != null && conversationId == null) {
            log.debug("Conversation {} not found for job {}; starting a new one", command.conversationId(), command.jobId());
        }

        List<ChatMessage> history = conversationId == null
                ? List.of()
                : conversationStore.recentHistory(conversationId, config.retrieval().historyLimit());
        JobContext context = contextProvider.load(identity.tenantId(), command.jobId(), command.message(), config.retrieval());

        ParsedResponse parsed = orchestrator.run(new CopilotRequest(
                UUID.randomUUID().toString(),
                context.snapshot(),
                context.evidenceText(),
                history,
                command.message(),
                config
        ));

        String answer = parsed.answer().isBlank() ? EMPTY_ANSWER : parsed.answer();
        List<Citation> citations = citationNormalizer.normalize(parsed.citations(), context.evidence());

        String storedConversationId = conversationStore.recordExchange(new CompletedExchange(
                conversationId,
                identity.tenantId(),
                command.jobId(),
                identity.userId(),
                command.message(),
                answer,
                citations,
                parsed.followUps(),
                context.evidence(),
                config.model().name(),
                config.prompt().version()
        ));

        Map<String, Object> debug = null;
        if (command.debug()) {
            debug = new LinkedHashMap<>();
            debug.put("promptVersion", config.prompt().version());
            debug.put("model", config.model().name());
            debug.put("historyTurns", history.size());
            debug.put("evidenceCount", context.evidence().size());
        }

        return new CopilotChatResponse(storedConversationId, answer, citations, parsed.followUps(),
                context.evidence(), debug);
    }

    @Override
    public Flux<String> streamChat(ChatCommand command) {
        return Mono.fromCallable(() -> chat(command))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(response -> Flux.concat(
                        Flux.fromIterable(deltas(response.answer())).map(delta -> toJson(Map.of("delta", delta))),
                        Mono.fromCallable(() -> toJson(response))
                ))
                .onErrorResume(error -> {
                    log.error("Copilot stream failed for job {}", command.jobId(), error);
                    return Mono.just(toJson(Map.of("error", String.valueOf(error.getMessage()))));
                });
    }

    @Override
    public ConversationHistoryResponse conversation(RequestIdentity identity, String jobId, String conversationId) {
        String resolved = conversationId == null || conversationId.isBlank()
                ? conversationStore.findLatestConversation(identity.tenantId(), jobId, identity.userId()).orElse(null)
                : conversationStore.findConversation(identity.tenantId(), jobId, conversationId).orElse(null);
        if (resolved == null) {
            return ConversationHistoryResponse.empty();
        }
        return new ConversationHistoryResponse(resolved, conversationStore.turns(resolved).stream()
                .map(turn -> new ConversationHistoryResponse.HistoryMessage(
                        turn.role(), turn.content(), turn.createdAt(), turn.metadataJson()))
                .toList());
    }

    /**
     * Splits the answer on single spaces; every piece but the last keeps its trailing space so the
     * deltas concatenate back to the exact answer.
     */
    static List<String> deltas(String answer) {
        String[] words = answer.split(" ", -1);
        List<String> deltas = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            String delta = i < words.length - 1 ? words[i] + " " : words[i];
            if (!delta.isEmpty()) {
                deltas.add(delta);
            }
        }
        return deltas;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream record", e);
        }
    }
}
