package com.hvacops.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.model.ChatRole;
import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.ConversationHistoryResponse;
import com.hvacops.copilot.model.CopilotChatResponse;
import com.hvacops.copilot.model.CopilotConfig;
import com.hvacops.copilot.model.CopilotRequest;
import com.hvacops.copilot.model.Evidence;
import com.hvacops.copilot.model.ParsedResponse;
import com.hvacops.copilot.security.RequestIdentity;
import com.hvacops.copilot.service.context.JobContext;
import com.hvacops.copilot.service.context.JobContextProvider;
import com.hvacops.copilot.service.memory.CompletedExchange;
import com.hvacops.copilot.service.memory.ConversationStore;
import com.hvacops.copilot.service.memory.StoredTurn;
import com.hvacops.copilot.service.orchestration.CopilotOrchestrator;
import com.hvacops.copilot.service.orchestration.ResponseParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultCopilotChatServiceTest {

    private static final RequestIdentity IDENTITY = new RequestIdentity("tenant-1", "tech-1");

    private final CopilotOrchestrator orchestrator = mock(CopilotOrchestrator.class);
    private final JobContextProvider contextProvider = mock(JobContextProvider.class);
    private final ConversationStore conversationStore = mock(ConversationStore.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CopilotConfig config = CopilotConfig.defaults();

    private DefaultCopilotChatService service;

    @BeforeEach
    void setUp() {
        service = new DefaultCopilotChatService(
                orchestrator,
                contextProvider,
                conversationStore,
                new CitationNormalizer(),
                config,
                objectMapper
        );
        when(contextProvider.load(anyString(), anyString(), anyString(), any())).thenReturn(new JobContext(
                Map.of("job", Map.of("id", "job-9")),
                "[note_1] rattling",
                List.of(new Evidence("note_1", "2024-11-12", "note", "Rattling from air handler", "Sam", null))
        ));
        when(conversationStore.recordExchange(any())).thenReturn("conv-1");
    }

    @Test
    void chatLoadsHistoryOrchestratesAndPersists() {
        when(conversationStore.findConversation("tenant-1", "job-9", "conv-1")).thenReturn(Optional.of("conv-1"));
        List<ChatMessage> history = List.of(ChatMessage.user("earlier"), ChatMessage.assistant("reply"));
        when(conversationStore.recentHistory("conv-1", 25)).thenReturn(history);
        when(orchestrator.run(any())).thenReturn(new ParsedResponse("Tighten the mount.", List.of(), List.of("Next?")));

        CopilotChatResponse response = service.chat(new ChatCommand(IDENTITY, "job-9", "Why the noise?", "conv-1", false));

        assertThat(response.conversationId()).isEqualTo("conv-1");
        assertThat(response.answer()).isEqualTo("Tighten the mount.");
        assertThat(response.followUps()).containsExactly("Next?");
        assertThat(response.citations()).extracting(Citation::docId).containsExactly("note_1");
        assertThat(response.evidence()).hasSize(1);
        assertThat(response.debug()).isNull();

        ArgumentCaptor<CopilotRequest> requestCaptor = ArgumentCaptor.forClass(CopilotRequest.class);
        verify(orchestrator).run(requestCaptor.capture());
        assertThat(requestCaptor.getValue().history()).isEqualTo(history);
        assertThat(requestCaptor.getValue().userInput()).isEqualTo("Why the noise?");
        assertThat(requestCaptor.getValue().evidenceText()).isEqualTo("[note_1] rattling");

        ArgumentCaptor<CompletedExchange> exchangeCaptor = ArgumentCaptor.forClass(CompletedExchange.class);
        verify(conversationStore).recordExchange(exchangeCaptor.capture());
        CompletedExchange stored = exchangeCaptor.getValue();
        assertThat(stored.conversationId()).isEqualTo("conv-1");
        assertThat(stored.userMessage()).isEqualTo("Why the noise?");
        assertThat(stored.answer()).isEqualTo("Tighten the mount.");
        assertThat(stored.model()).isEqualTo("gpt-4o");
        assertThat(stored.promptVersion()).isEqualTo("copilot.v1");
    }

    @Test
    void unknownConversationStartsFresh() {
        when(conversationStore.findConversation("tenant-1", "job-9", "stale")).thenReturn(Optional.empty());
        when(orchestrator.run(any())).thenReturn(new ParsedResponse("ok", List.of(), List.of()));

        service.chat(new ChatCommand(IDENTITY, "job-9", "hi", "stale", false));

        verify(conversationStore, never()).recentHistory(anyString(), eq(25));
        ArgumentCaptor<CompletedExchange> exchangeCaptor = ArgumentCaptor.forClass(CompletedExchange.class);
        verify(conversationStore).recordExchange(exchangeCaptor.capture());
        assertThat(exchangeCaptor.getValue().conversationId()).isNull();
    }

    @Test
    void blankAnswerIsReplacedAndDebugIsReported() {
        when(conversationStore.findConversation(any(), any(), any())).thenReturn(Optional.empty());
        when(orchestrator.run(any())).thenReturn(new ParsedResponse("  ", List.of(), List.of()));

        CopilotChatResponse response = service.chat(new ChatCommand(IDENTITY, "job-9", "hi", null, true));

        assertThat(response.answer()).isEqualTo(DefaultCopilotChatService.EMPTY_ANSWER);
        assertThat(response.debug())
                .containsEntry("promptVersion", "copilot.v1")
                .containsEntry("model", "gpt-4o")
                .containsEntry("historyTurns", 0)
                .containsEntry("evidenceCount", 1);
    }

    @Test
    void failedOrchestrationPersistsNothing() {
        when(conversationStore.findConversation(any(), any(), any())).thenReturn(Optional.empty());
        when(orchestrator.run(any())).thenThrow(new ResponseParseException("No JSON object found in model output"));

        StepVerifier.create(service.streamChat(new ChatCommand(IDENTITY, "job-9", "hi", null, false)))
                .assertNext(json -> assertThat(read(json).path("error").asText())
                        .isEqualTo("No JSON object found in model output"))
                .verifyComplete();

        verify(conversationStore, never()).recordExchange(any());
    }

    @Test
    void streamEmitsWordDeltasThenTerminalRecord() {
        when(conversationStore.findConversation(any(), any(), any())).thenReturn(Optional.empty());
        when(orchestrator.run(any())).thenReturn(new ParsedResponse("Check the blower mount", List.of(), List.of("More?")));

        List<JsonNode> records = new ArrayList<>();
        StepVerifier.create(service.streamChat(new ChatCommand(IDENTITY, "job-9", "hi", null, false)))
                .thenConsumeWhile(json -> records.add(read(json)))
                .verifyComplete();

        assertThat(records).hasSize(5);
        StringBuilder joined = new StringBuilder();
        for (JsonNode record : records.subList(0, 4)) {
            joined.append(record.path("delta").asText());
        }
        assertThat(joined.toString()).isEqualTo("Check the blower mount");
        assertThat(records.get(0).path("delta").asText()).isEqualTo("Check ");
        assertThat(records.get(3).path("delta").asText()).isEqualTo("mount");

        JsonNode terminal = records.get(4);
        assertThat(terminal.path("answer").asText()).isEqualTo("Check the blower mount");
        assertThat(terminal.path("conversation_id").asText()).isEqualTo("conv-1");
        assertThat(terminal.path("follow_ups").get(0).asText()).isEqualTo("More?");
        assertThat(terminal.has("delta")).isFalse();
    }

    @Test
    void deltasConcatenateToExactAnswer() {
        assertThat(String.join("", DefaultCopilotChatService.deltas("a  b c "))).isEqualTo("a  b c ");
        assertThat(DefaultCopilotChatService.deltas("single")).containsExactly("single");
        assertThat(DefaultCopilotChatService.deltas("")).isEmpty();
    }

    @Test
    void conversationDefaultsToLatestForUser() {
        OffsetDateTime createdAt = OffsetDateTime.parse("2024-11-12T17:40:00Z");
        when(conversationStore.findLatestConversation("tenant-1", "job-9", "tech-1")).thenReturn(Optional.of("conv-7"));
        when(conversationStore.turns("conv-7")).thenReturn(List.of(
                new StoredTurn(ChatRole.USER, "hi", createdAt, "{\"type\":\"user_message\"}"),
                new StoredTurn(ChatRole.ASSISTANT, "hello", createdAt, "{\"citations\":[]}")
        ));

        ConversationHistoryResponse history = service.conversation(IDENTITY, "job-9", null);

        assertThat(history.conversationId()).isEqualTo("conv-7");
        assertThat(history.messages()).extracting(ConversationHistoryResponse.HistoryMessage::role)
                .containsExactly(ChatRole.USER, ChatRole.ASSISTANT);
    }

    @Test
    void conversationFromAnotherJobIsEmpty() {
        when(conversationStore.findConversation("tenant-1", "job-9", "conv-other")).thenReturn(Optional.empty());

        ConversationHistoryResponse history = service.conversation(IDENTITY, "job-9", "conv-other");

        assertThat(history.conversationId()).isNull();
        assertThat(history.messages()).isEmpty();
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AssertionError("Invalid JSON record: " + json, e);
        }
    }
}
