package com.hvacops.copilot.client.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.model.CopilotReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

final class SourceMapper {

    private static final Logger log = LoggerFactory.getLogger(SourceMapper.class);

    private SourceMapper() {
    }

    /**
     * Evidence wins over citations when the reply carries both.
     */
    static List<MessageSource> fromReply(CopilotReply reply) {
        if (!reply.evidence().isEmpty()) {
            return reply.evidence().stream()
                    .map(item -> new MessageSource(item.text(), item.date(), item.type(), item.authorName(),
                            item.authorEmail()))
                    .toList();
        }
        return reply.citations().stream()
                .map(citation -> new MessageSource(citation.snippet(), citation.date(), citation.type(),
                        citation.authorName(), citation.authorEmail()))
                .toList();
    }

    /**
     * Reads the citations stored with a persisted assistant turn. Entries without a string
     * snippet are dropped; unreadable metadata yields no sources.
     */
    static List<MessageSource> fromMetadata(String metadataJson, ObjectMapper objectMapper) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return List.of();
        }
        JsonNode citations;
        try {
            citations = objectMapper.readTree(metadataJson).path("citations");
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable message metadata: {}", e.getOriginalMessage());
            return List.of();
        }
        if (!citations.isArray()) {
            return List.of();
        }
        List<MessageSource> sources = new ArrayList<>();
        for (JsonNode citation : citations) {
            if (!citation.isObject() || !citation.path("snippet").isTextual()) {
                continue;
            }
            sources.add(new MessageSource(
                    citation.get("snippet").asText(),
                    text(citation, "date"),
                    text(citation, "type"),
                    text(citation, "author_name"),
                    text(citation, "author_email")
            ));
        }
        return sources;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
