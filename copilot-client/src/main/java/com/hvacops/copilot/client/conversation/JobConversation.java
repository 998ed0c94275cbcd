package com.hvacops.copilot.client.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.model.ConversationHistory;
import com.hvacops.copilot.client.model.CopilotReply;
import com.hvacops.copilot.client.model.CopilotTurnRequest;
import com.hvacops.copilot.client.model.HistoryTurn;
import com.hvacops.copilot.client.stream.StreamIncompleteException;
import com.hvacops.copilot.client.transport.CopilotTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.listener.StateMachineListenerAdapter;
import org.springframework.statemachine.state.State;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Conversation state for one job chat: the visible messages, follow-up suggestions and the
 * server conversation id, advanced one turn at a time.
 *
 * <p>Each turn adds the user message plus a loading placeholder, streams deltas into the
 * placeholder, then replaces it in place with either the finalized answer or a fixed apology.
 * Only one turn may be in flight; further sends are ignored until it resolves. Errors never
 * escape {@link #sendMessage} and their text is never shown.</p>
 */
public class JobConversation implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobConversation.class);

    public static final String THINKING = "Thinking...";
    public static final String UNAVAILABLE =
            "Copilot is unavailable right now. Please try again in a moment or check your connection.";

    private final CopilotTransport transport;
    private final String jobId;
    private final Participant user;
    private final ObjectMapper objectMapper;
    private final List<ConversationListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    private final List<DisplayMessage> messages = new ArrayList<>();
    private List<String> followUps = List.of();
    private String conversationId;
    private final StateMachine<TurnState, TurnEvent> stateMachine;
    private ActiveTurn activeTurn;
    private boolean closed;

    public JobConversation(CopilotTransport transport, String jobId, Participant user, ObjectMapper objectMapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.jobId = jobId;
        this.user = user == null ? new Participant(null, null) : user;
        this.objectMapper = objectMapper;
        this.stateMachine = TurnStateMachineConfig.build("copilot-" + jobId);
        this.stateMachine.addStateListener(new StateRelay());
        this.stateMachine.startReactively().subscribe();
    }

    public void addListener(ConversationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConversationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a turn immediately. The returned Mono completes once the placeholder has been
     * resolved, successfully or not; it never errors.
     */
    public Mono<Void> sendMessage(String content) {
        if (content == null || content.isBlank() || jobId == null || jobId.isBlank()) {
            return Mono.empty();
        }

        ActiveTurn turn;
        String requestConversationId;
        synchronized (this) {
            if (closed) {
                log.warn("Ignoring message for job {}: conversation is closed", jobId);
                return Mono.empty();
            }
            if (activeTurn != null) {
                log.warn("Ignoring message for job {}: a reply is still in progress", jobId);
                return Mono.empty();
            }
            Instant now = Instant.now();
            messages.add(new DisplayMessage(nextId("user"), DisplayMessage.Role.USER, content, now,
                    user.id(), user.name(), false, List.of()));
            DisplayMessage placeholder = new DisplayMessage(nextId("ai"), DisplayMessage.Role.ASSISTANT, THINKING,
                    now, Participant.COPILOT.id(), Participant.COPILOT.name(), true, List.of());
            messages.add(placeholder);
            turn = new ActiveTurn(placeholder.id());
            activeTurn = turn;
            requestConversationId = conversationId;
            fire(TurnEvent.SEND);
            publishMessages();
        }

        Disposable subscription = transport
                .stream(jobId, CopilotTurnRequest.of(content, requestConversationId), delta -> applyDelta(turn, delta))
                .switchIfEmpty(Mono.error(StreamIncompleteException::new))
                .doOnCancel(() -> failTurn(turn, new CancellationException("Copilot request cancelled")))
                .subscribe(reply -> finalizeTurn(turn, reply), error -> failTurn(turn, error));
        turn.attach(subscription);
        return turn.done.asMono();
    }

    /**
     * Rebuilds the visible history from the server. Failures are logged and leave the
     * conversation as it was.
     */
    public Mono<Void> restore() {
        if (jobId == null || jobId.isBlank()) {
            return Mono.empty();
        }
        String requested;
        synchronized (this) {
            requested = conversationId;
        }
        return transport.loadConversation(jobId, requested)
                .doOnNext(this::applyHistory)
                .doOnError(error -> log.warn("Failed to restore copilot conversation for job {}", jobId, error))
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    /**
     * Cancels an in-flight turn, resolving its placeholder as failed, and ignores later sends.
     */
    @Override
    public void close() {
        ActiveTurn turn;
        synchronized (this) {
            closed = true;
            turn = activeTurn;
        }
        if (turn != null) {
            turn.cancel();
            failTurn(turn, new CancellationException("Conversation closed"));
        }
        stateMachine.stopReactively().subscribe();
    }

    public synchronized List<DisplayMessage> messages() {
        return List.copyOf(messages);
    }

    public synchronized List<String> followUps() {
        return followUps;
    }

    public synchronized String conversationId() {
        return conversationId;
    }

    public synchronized TurnState state() {
        State<TurnState, TurnEvent> current = stateMachine.getState();
        return current == null ? TurnState.IDLE : current.getId();
    }

    public synchronized boolean isSending() {
        return activeTurn != null;
    }

    public String jobId() {
        return jobId;
    }

    private synchronized void applyDelta(ActiveTurn turn, String delta) {
        if (activeTurn != turn || delta == null) {
            return;
        }
        if (!turn.receivedDelta) {
            turn.receivedDelta = true;
            fire(TurnEvent.DELTA);
        }
        turn.streamed.append(delta);
        replacePlaceholder(turn, current -> current.withContent(turn.streamed.toString(), false));
        publishMessages();
    }

    private synchronized void finalizeTurn(ActiveTurn turn, CopilotReply reply) {
        if (activeTurn != turn) {
            return;
        }
        fire(TurnEvent.TERMINAL);
        String content = turn.receivedDelta ? turn.streamed.toString() : reply.answer();
        List<MessageSource> sources = SourceMapper.fromReply(reply);
        replacePlaceholder(turn, current -> current.resolved(content, sources));
        if (reply.conversationId() != null) {
            conversationId = reply.conversationId();
        }
        followUps = List.copyOf(reply.followUps());
        activeTurn = null;
        publishMessages();
        listeners.forEach(listener -> listener.onFollowUpsChanged(followUps));
        fire(TurnEvent.RESET);
        turn.done.tryEmitEmpty();
    }

    private synchronized void failTurn(ActiveTurn turn, Throwable error) {
        if (activeTurn != turn) {
            return;
        }
        log.warn("Copilot turn failed for job {}", jobId, error);
        fire(TurnEvent.ERROR);
        replacePlaceholder(turn, current -> current.resolved(UNAVAILABLE, List.of()));
        activeTurn = null;
        publishMessages();
        fire(TurnEvent.RESET);
        turn.done.tryEmitEmpty();
    }

    private synchronized void applyHistory(ConversationHistory history) {
        if (activeTurn != null) {
            log.debug("Skipping history restore for job {} while a reply is in progress", jobId);
            return;
        }
        if (history.conversationId() != null) {
            conversationId = history.conversationId();
        }
        List<DisplayMessage> restored = new ArrayList<>(history.messages().size());
        List<HistoryTurn> turns = history.messages();
        for (int index = 0; index < turns.size(); index++) {
            restored.add(restoredMessage(index, turns.get(index)));
        }
        messages.clear();
        messages.addAll(restored);
        publishMessages();
    }

    private DisplayMessage restoredMessage(int index, HistoryTurn turn) {
        boolean assistant = turn.isAssistant();
        List<MessageSource> sources = assistant
                ? SourceMapper.fromMetadata(turn.metadataJson(), objectMapper)
                : List.of();
        Participant sender = assistant ? Participant.COPILOT : user;
        return new DisplayMessage(
                "history-" + index + "-" + turn.createdAt(),
                assistant ? DisplayMessage.Role.ASSISTANT : DisplayMessage.Role.USER,
                turn.content() == null ? "" : turn.content(),
                parseTimestamp(turn.createdAt()),
                sender.id(),
                sender.name(),
                false,
                sources
        );
    }

    private Instant parseTimestamp(String value) {
        if (value == null) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    private void replacePlaceholder(ActiveTurn turn, UnaryOperator<DisplayMessage> update) {
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).id().equals(turn.placeholderId)) {
                messages.set(i, update.apply(messages.get(i)));
                return;
            }
        }
    }

    private void fire(TurnEvent event) {
        stateMachine.sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                .filter(result -> result.getResultType() == StateMachineEventResult.ResultType.DENIED)
                .subscribe(result -> log.warn("Turn event {} denied for job {} in state {}",
                        event, jobId, stateMachine.getState().getId()));
    }

    private void publishMessages() {
        List<DisplayMessage> snapshot = List.copyOf(messages);
        listeners.forEach(listener -> listener.onMessagesChanged(snapshot));
    }

    private String nextId(String prefix) {
        return prefix + "-" + System.currentTimeMillis() + "-" + ids.incrementAndGet();
    }

    private final class StateRelay extends StateMachineListenerAdapter<TurnState, TurnEvent> {

        @Override
        public void stateChanged(State<TurnState, TurnEvent> from, State<TurnState, TurnEvent> to) {
            if (from == null || to == null) {
                return;
            }
            listeners.forEach(listener -> listener.onStateChanged(to.getId()));
        }
    }

    private static final class ActiveTurn {

        private final String placeholderId;
        private final StringBuilder streamed = new StringBuilder();
        private final Sinks.Empty<Void> done = Sinks.empty();
        private boolean receivedDelta;
        private Disposable subscription;
        private boolean cancelled;

        private ActiveTurn(String placeholderId) {
            this.placeholderId = placeholderId;
        }

        synchronized void attach(Disposable subscription) {
            if (cancelled) {
                subscription.dispose();
            } else {
                this.subscription = subscription;
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (subscription != null) {
                subscription.dispose();
            }
        }
    }
}
