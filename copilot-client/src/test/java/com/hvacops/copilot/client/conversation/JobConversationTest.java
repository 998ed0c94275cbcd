package com.hvacops.copilot.client.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.model.CitationPayload;
import com.hvacops.copilot.client.model.ConversationHistory;
import com.hvacops.copilot.client.model.CopilotReply;
import com.hvacops.copilot.client.model.CopilotTurnRequest;
import com.hvacops.copilot.client.model.EvidencePayload;
import com.hvacops.copilot.client.model.HistoryTurn;
import com.hvacops.copilot.client.stream.DeltaListener;
import com.hvacops.copilot.client.stream.StreamingReplyReader;
import com.hvacops.copilot.client.transport.CopilotInvocationException;
import com.hvacops.copilot.client.transport.CopilotTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobConversationTest {

    private static final Participant TECH = new Participant("tech-7", "Dana Tech");

    private ScriptedTransport transport;
    private JobConversation conversation;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        conversation = new JobConversation(transport, "job-1", TECH, new ObjectMapper());
    }

    @Test
    void streamedTurnFinalizesPlaceholderInPlace() {
        transport.deltas = List.of("Tighten ", "the ", "mount");
        transport.reply = Mono.just(new CopilotReply("conv-1", "Tighten the mount.",
                List.of(new CitationPayload("n1", "2024-11-12", "note", "cited", null, null)),
                List.of("Any parts replaced?"),
                List.of(new EvidencePayload("n1", "2024-11-12", "note", "rattling air handler", "Sam", "sam@example.com"))));

        StepVerifier.create(conversation.sendMessage("What is that noise?")).verifyComplete();

        List<DisplayMessage> messages = conversation.messages();
        assertThat(messages).hasSize(2);
        DisplayMessage question = messages.get(0);
        assertThat(question.role()).isEqualTo(DisplayMessage.Role.USER);
        assertThat(question.content()).isEqualTo("What is that noise?");
        assertThat(question.senderId()).isEqualTo("tech-7");

        DisplayMessage answer = messages.get(1);
        assertThat(answer.id()).startsWith("ai-");
        assertThat(answer.role()).isEqualTo(DisplayMessage.Role.ASSISTANT);
        assertThat(answer.content()).isEqualTo("Tighten the mount");
        assertThat(answer.loading()).isFalse();
        assertThat(answer.senderName()).isEqualTo(Participant.COPILOT.name());
        assertThat(answer.sources()).containsExactly(
                new MessageSource("rattling air handler", "2024-11-12", "note", "Sam", "sam@example.com"));

        assertThat(conversation.followUps()).containsExactly("Any parts replaced?");
        assertThat(conversation.conversationId()).isEqualTo("conv-1");
        assertThat(conversation.state()).isEqualTo(TurnState.IDLE);
        assertThat(conversation.isSending()).isFalse();
    }

    @Test
    void answerIsUsedWhenNoDeltaArrives() {
        transport.reply = Mono.just(new CopilotReply("conv-1", "Last maintenance was in March.",
                List.of(new CitationPayload("n2", "2024-03-02", "note", "PM visit", null, null)), List.of(), List.of()));

        conversation.sendMessage("Last maintenance?").block();

        DisplayMessage answer = conversation.messages().get(1);
        assertThat(answer.content()).isEqualTo("Last maintenance was in March.");
        assertThat(answer.sources()).extracting(MessageSource::snippet).containsExactly("PM visit");
    }

    @Test
    void conversationIdCarriesIntoNextTurn() {
        transport.reply = Mono.just(new CopilotReply("conv-1", "first", null, null, null));
        conversation.sendMessage("one").block();
        transport.reply = Mono.just(new CopilotReply(null, "second", null, null, null));
        conversation.sendMessage("two").block();

        assertThat(transport.requests).extracting(CopilotTurnRequest::conversationId).containsExactly(null, "conv-1");
        assertThat(conversation.conversationId()).isEqualTo("conv-1");
        assertThat(conversation.messages()).extracting(DisplayMessage::content)
                .containsExactly("one", "first", "two", "second");
    }

    @Test
    void failedTurnShowsApologyWithoutErrorText() {
        transport.deltas = List.of("partial ");
        transport.reply = Mono.error(new CopilotInvocationException(502, "{\"error\":\"Model request failed\"}"));

        StepVerifier.create(conversation.sendMessage("hello")).verifyComplete();

        DisplayMessage answer = conversation.messages().get(1);
        assertThat(answer.content()).isEqualTo(JobConversation.UNAVAILABLE);
        assertThat(answer.loading()).isFalse();
        assertThat(answer.sources()).isEmpty();
        assertThat(conversation.state()).isEqualTo(TurnState.IDLE);
        assertThat(conversation.followUps()).isEmpty();
    }

    @Test
    void emptyReplyCountsAsFailure() {
        transport.reply = Mono.empty();

        conversation.sendMessage("hello").block();

        assertThat(conversation.messages().get(1).content()).isEqualTo(JobConversation.UNAVAILABLE);
    }

    @Test
    void streamEndingWithoutTerminalResolvesToApology() {
        transport.reply = Mono.just(new CopilotReply("conv-1", "first answer", null, List.of("Next?"), null));
        conversation.sendMessage("first").block();

        transport.eventStream = Flux.just(
                "data: {\"delta\":\"Checking \"}\n\n",
                "data: {broken json\n\n",
                "data: {\"delta\":\"the notes\"}\n\n")
                .map(chunk -> chunk.getBytes(StandardCharsets.UTF_8));
        List<DisplayMessage> seen = new ArrayList<>();
        conversation.addListener(new ConversationListener() {
            @Override
            public void onMessagesChanged(List<DisplayMessage> messages) {
                seen.add(messages.get(messages.size() - 1));
            }
        });

        StepVerifier.create(conversation.sendMessage("second")).verifyComplete();

        assertThat(seen).extracting(DisplayMessage::content).contains("Checking ", "Checking the notes");
        DisplayMessage answer = conversation.messages().get(3);
        assertThat(answer.content()).isEqualTo(JobConversation.UNAVAILABLE);
        assertThat(answer.loading()).isFalse();
        assertThat(conversation.conversationId()).isEqualTo("conv-1");
        assertThat(conversation.followUps()).containsExactly("Next?");
        assertThat(conversation.state()).isEqualTo(TurnState.IDLE);
        assertThat(conversation.isSending()).isFalse();
    }

    @Test
    void onlyOneTurnInFlight() {
        Sinks.One<CopilotReply> pending = Sinks.one();
        transport.reply = pending.asMono();

        conversation.sendMessage("first");
        assertThat(conversation.messages().get(1).content()).isEqualTo(JobConversation.THINKING);
        assertThat(conversation.messages().get(1).loading()).isTrue();

        StepVerifier.create(conversation.sendMessage("second")).verifyComplete();
        assertThat(conversation.messages()).hasSize(2);
        assertThat(transport.requests).hasSize(1);

        transport.listener.onDelta("Done");
        assertThat(conversation.state()).isEqualTo(TurnState.STREAMING);
        assertThat(conversation.messages().get(1).content()).isEqualTo("Done");

        pending.tryEmitValue(new CopilotReply("conv-1", "Done", null, null, null));
        assertThat(conversation.isSending()).isFalse();

        transport.reply = Mono.just(new CopilotReply("conv-1", "again", null, null, null));
        conversation.sendMessage("third").block();
        assertThat(conversation.messages()).hasSize(4);
    }

    @Test
    void closeCancelsInFlightTurn() {
        Sinks.One<CopilotReply> pending = Sinks.one();
        transport.reply = pending.asMono();
        Mono<Void> done = conversation.sendMessage("hello");
        assertThat(pending.currentSubscriberCount()).isEqualTo(1);

        conversation.close();

        StepVerifier.create(done).verifyComplete();
        assertThat(pending.currentSubscriberCount()).isZero();
        assertThat(conversation.messages().get(1).content()).isEqualTo(JobConversation.UNAVAILABLE);
        assertThat(conversation.isSending()).isFalse();

        StepVerifier.create(conversation.sendMessage("after close")).verifyComplete();
        assertThat(transport.requests).hasSize(1);
    }

    @Test
    void blankInputIsIgnored() {
        StepVerifier.create(conversation.sendMessage("   ")).verifyComplete();
        StepVerifier.create(conversation.sendMessage(null)).verifyComplete();

        assertThat(conversation.messages()).isEmpty();
        assertThat(transport.requests).isEmpty();
    }

    @Test
    void missingJobIdIsIgnored() {
        JobConversation unbound = new JobConversation(transport, null, TECH, new ObjectMapper());

        StepVerifier.create(unbound.sendMessage("hello")).verifyComplete();

        assertThat(unbound.messages()).isEmpty();
        assertThat(transport.requests).isEmpty();
    }

    @Test
    void listenersSeeTurnLifecycle() {
        List<TurnState> states = new ArrayList<>();
        List<List<String>> followUps = new ArrayList<>();
        conversation.addListener(new ConversationListener() {
            @Override
            public void onStateChanged(TurnState state) {
                states.add(state);
            }

            @Override
            public void onFollowUpsChanged(List<String> suggestions) {
                followUps.add(suggestions);
            }
        });
        transport.deltas = List.of("a");
        transport.reply = Mono.just(new CopilotReply(null, "a", null, List.of("next?"), null));

        conversation.sendMessage("hi").block();
        transport.deltas = List.of();
        transport.reply = Mono.error(new IllegalStateException("offline"));
        conversation.sendMessage("again").block();

        assertThat(states).containsExactly(
                TurnState.SENDING, TurnState.STREAMING, TurnState.FINALIZING, TurnState.IDLE,
                TurnState.SENDING, TurnState.FAILED, TurnState.IDLE);
        assertThat(followUps).containsExactly(List.of("next?"));
    }

    @Test
    void restoreRebuildsHistoryWithSources() {
        transport.history = Mono.just(new ConversationHistory("conv-5", List.of(
                new HistoryTurn("user", "Any rattles?", "2024-11-12T17:40:00Z", "{\"type\":\"user_message\"}"),
                new HistoryTurn("assistant", "Yes, on the blower.", "2024-11-12T17:40:02Z",
                        "{\"type\":\"assistant_message\",\"citations\":[{\"doc_id\":\"n1\",\"snippet\":\"blower rattle\","
                                + "\"date\":\"2024-11-01\",\"type\":\"note\"}]}"))));

        StepVerifier.create(conversation.restore()).verifyComplete();

        List<DisplayMessage> messages = conversation.messages();
        assertThat(messages).extracting(DisplayMessage::id)
                .containsExactly("history-0-2024-11-12T17:40:00Z", "history-1-2024-11-12T17:40:02Z");
        assertThat(messages.get(0).role()).isEqualTo(DisplayMessage.Role.USER);
        assertThat(messages.get(0).senderName()).isEqualTo("Dana Tech");
        assertThat(messages.get(1).role()).isEqualTo(DisplayMessage.Role.ASSISTANT);
        assertThat(messages.get(1).sources())
                .containsExactly(new MessageSource("blower rattle", "2024-11-01", "note", null, null));
        assertThat(messages.get(1).timestamp().toString()).isEqualTo("2024-11-12T17:40:02Z");
        assertThat(conversation.conversationId()).isEqualTo("conv-5");
    }

    @Test
    void failedRestoreKeepsCurrentMessages() {
        transport.reply = Mono.just(new CopilotReply("conv-1", "hi there", null, null, null));
        conversation.sendMessage("hi").block();
        transport.history = Mono.error(new CopilotInvocationException(500, "boom"));

        StepVerifier.create(conversation.restore()).verifyComplete();

        assertThat(conversation.messages()).extracting(DisplayMessage::content).containsExactly("hi", "hi there");
        assertThat(transport.historyRequests).containsExactly("conv-1");
    }

    private static final class ScriptedTransport implements CopilotTransport {

        private final List<CopilotTurnRequest> requests = new ArrayList<>();
        private final List<String> historyRequests = new ArrayList<>();
        private List<String> deltas = List.of();
        private Mono<CopilotReply> reply = Mono.empty();
        private Mono<ConversationHistory> history = Mono.just(ConversationHistory.empty());
        private Flux<byte[]> eventStream;
        private DeltaListener listener;
        private final StreamingReplyReader reader = new StreamingReplyReader(new ObjectMapper());

        @Override
        public Mono<CopilotReply> send(String jobId, CopilotTurnRequest request) {
            requests.add(request);
            return reply;
        }

        @Override
        public Mono<CopilotReply> stream(String jobId, CopilotTurnRequest request, DeltaListener deltaListener) {
            requests.add(request);
            listener = deltaListener;
            if (eventStream != null) {
                return reader.readChunks(eventStream, deltaListener);
            }
            List<String> scripted = deltas;
            Mono<CopilotReply> scriptedReply = reply;
            return Mono.defer(() -> {
                scripted.forEach(deltaListener::onDelta);
                return scriptedReply;
            });
        }

        @Override
        public Mono<ConversationHistory> loadConversation(String jobId, String conversationId) {
            historyRequests.add(conversationId);
            return history;
        }
    }
}
