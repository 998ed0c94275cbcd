package com.hvacops.copilot.controller;

import com.hvacops.copilot.model.ChatSubmission;
import com.hvacops.copilot.model.ConversationHistoryResponse;
import com.hvacops.copilot.model.CopilotChatResponse;
import com.hvacops.copilot.security.RequestIdentity;
import com.hvacops.copilot.security.RequestIdentityResolver;
import com.hvacops.copilot.service.ChatCommand;
import com.hvacops.copilot.service.CopilotChatService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/jobs/{jobId}/ai")
public class CopilotChatController {

    static final String CONVERSATION_HEADER = "x-conversation-id";
    static final String DEBUG_HEADER = "x-debug";

    private final CopilotChatService chatService;
    private final RequestIdentityResolver identityResolver;

    public CopilotChatController(CopilotChatService chatService, RequestIdentityResolver identityResolver) {
        this.chatService = chatService;
        this.identityResolver = identityResolver;
    }

    /**
     * Answers as an event stream when the caller accepts {@code text/event-stream}, or asks for
     * {@code stream: true} without stating a preference; otherwise as a single JSON reply.
     */
    @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> chat(@PathVariable String jobId,
                                        @Valid @RequestBody ChatSubmission submission,
                                        @RequestHeader HttpHeaders headers) {
        RequestIdentity identity = identityResolver.resolve(
                headers.getFirst(RequestIdentityResolver.TENANT_HEADER),
                headers.getFirst(RequestIdentityResolver.USER_HEADER));
        ChatCommand command = new ChatCommand(identity, jobId, submission.message().trim(),
                submission.conversationId(), "1".equals(headers.getFirst(DEBUG_HEADER)));

        if (wantsStream(headers.getAccept(), submission.stream())) {
            Flux<ServerSentEvent<String>> events = chatService.streamChat(command)
                    .map(data -> ServerSentEvent.builder(data).build());
            return Mono.just(ResponseEntity.ok()
                    .contentType(MediaType.TEXT_EVENT_STREAM)
                    .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                    .body(events));
        }

        return Mono.fromCallable(() -> chatService.chat(command))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::jsonReply);
    }

    @GetMapping(path = "/conversation", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ConversationHistoryResponse> conversation(@PathVariable String jobId,
                                                          @RequestParam(required = false) String conversationId,
                                                          @RequestHeader(name = RequestIdentityResolver.TENANT_HEADER, required = false) String tenantId,
                                                          @RequestHeader(name = RequestIdentityResolver.USER_HEADER, required = false) String userId) {
        RequestIdentity identity = identityResolver.resolve(tenantId, userId);
        return Mono.fromCallable(() -> chatService.conversation(identity, jobId, conversationId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<?> jsonReply(CopilotChatResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON);
        if (response.conversationId() != null) {
            builder.header(CONVERSATION_HEADER, response.conversationId());
        }
        return builder.body(response);
    }

    static boolean wantsStream(List<MediaType> accept, Boolean streamFlag) {
        for (MediaType mediaType : accept) {
            if (MediaType.TEXT_EVENT_STREAM.isCompatibleWith(mediaType) && !mediaType.isWildcardType()) {
                return true;
            }
        }
        boolean noPreference = accept.isEmpty() || accept.stream().allMatch(MediaType::isWildcardType);
        return Boolean.TRUE.equals(streamFlag) && noPreference;
    }
}
