package com.hvacops.copilot.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.conversation.JobConversation;
import com.hvacops.copilot.client.conversation.Participant;
import com.hvacops.copilot.client.mock.OfflineMockResponder;
import com.hvacops.copilot.client.stream.StreamingReplyReader;
import com.hvacops.copilot.client.transport.CopilotTransport;
import com.hvacops.copilot.client.transport.OfflineCopilotTransport;
import com.hvacops.copilot.client.transport.WebClientCopilotTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Entry point for building copilot transports and per-job conversations.
 */
public final class CopilotClients {

    private static final Logger log = LoggerFactory.getLogger(CopilotClients.class);

    private CopilotClients() {
    }

    public static CopilotTransport transport(CopilotClientSettings settings) {
        if (!settings.hasBackend()) {
            log.info("No copilot base URL configured; using offline responses");
            return new OfflineCopilotTransport(new OfflineMockResponder());
        }
        return new WebClientCopilotTransport(webClient(settings), settings, new StreamingReplyReader(objectMapper()));
    }

    public static JobConversation conversation(CopilotTransport transport, String jobId, Participant user) {
        return new JobConversation(transport, jobId, user, objectMapper());
    }

    static WebClient webClient(CopilotClientSettings settings) {
        HttpClient httpClient = HttpClient.create().responseTimeout(settings.timeout());
        return WebClient.builder()
                .baseUrl(settings.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build())
                .build();
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
