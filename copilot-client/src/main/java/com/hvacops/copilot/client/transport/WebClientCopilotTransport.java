package com.hvacops.copilot.client.transport;

import com.hvacops.copilot.client.CopilotClientSettings;
import com.hvacops.copilot.client.model.ConversationHistory;
import com.hvacops.copilot.client.model.CopilotReply;
import com.hvacops.copilot.client.model.CopilotTurnRequest;
import com.hvacops.copilot.client.stream.DeltaListener;
import com.hvacops.copilot.client.stream.StreamingReplyReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

public class WebClientCopilotTransport implements CopilotTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientCopilotTransport.class);
    static final String TENANT_HEADER = "x-tenant-id";
    static final String USER_HEADER = "x-user-id";

    private final WebClient webClient;
    private final CopilotClientSettings settings;
    private final StreamingReplyReader replyReader;

    public WebClientCopilotTransport(WebClient webClient,
                                     CopilotClientSettings settings,
                                     StreamingReplyReader replyReader) {
        this.webClient = webClient;
        this.settings = settings;
        this.replyReader = replyReader;
    }

    @Override
    public Mono<CopilotReply> send(String jobId, CopilotTurnRequest request) {
        return webClient.post()
                .uri("/jobs/{jobId}/ai/chat", jobId)
                .headers(this::identityHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(this::readReply)
                .timeout(settings.timeout());
    }

    @Override
    public Mono<CopilotReply> stream(String jobId, CopilotTurnRequest request, DeltaListener listener) {
        return webClient.post()
                .uri("/jobs/{jobId}/ai/chat", jobId)
                .headers(this::identityHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(request.streaming())
                .exchangeToMono(response -> {
                    if (response.statusCode().isError()) {
                        return invocationError(response);
                    }
                    MediaType contentType = response.headers().contentType().orElse(null);
                    if (contentType != null && MediaType.TEXT_EVENT_STREAM.isCompatibleWith(contentType)) {
                        return replyReader.read(response.bodyToFlux(DataBuffer.class), listener);
                    }
                    log.debug("Copilot answered {} without an event stream; reading a single reply", contentType);
                    return readReply(response);
                })
                .timeout(settings.timeout());
    }

    @Override
    public Mono<ConversationHistory> loadConversation(String jobId, String conversationId) {
        return webClient.get()
                .uri(builder -> {
                    builder.path("/jobs/{jobId}/ai/conversation");
                    if (conversationId != null && !conversationId.isBlank()) {
                        builder.queryParam("conversationId", conversationId);
                    }
                    return builder.build(jobId);
                })
                .headers(this::identityHeaders)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.statusCode().isError()
                        ? invocationError(response)
                        : response.bodyToMono(ConversationHistory.class).defaultIfEmpty(ConversationHistory.empty()))
                .timeout(settings.timeout());
    }

    private Mono<CopilotReply> readReply(ClientResponse response) {
        if (response.statusCode().isError()) {
            return invocationError(response);
        }
        return response.bodyToMono(CopilotReply.class)
                .switchIfEmpty(Mono.error(() -> new CopilotInvocationException("Copilot returned an empty reply")));
    }

    private <T> Mono<T> invocationError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new CopilotInvocationException(status, body)));
    }

    private void identityHeaders(HttpHeaders headers) {
        String token = settings.tokenSupplier().get();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
            return;
        }
        if (settings.devTenantId() != null && !settings.devTenantId().isBlank()) {
            headers.set(TENANT_HEADER, settings.devTenantId());
        }
        if (settings.devUserId() != null && !settings.devUserId().isBlank()) {
            headers.set(USER_HEADER, settings.devUserId());
        }
    }
}
