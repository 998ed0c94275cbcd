package com.hvacops.copilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationHistoryResponse(@JsonProperty("conversation_id") String conversationId,
                                          List<HistoryMessage> messages) {

    public ConversationHistoryResponse {
        messages = messages == null ? List.of() : messages;
    }

    public static ConversationHistoryResponse empty() {
        return new ConversationHistoryResponse(null, List.of());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HistoryMessage(ChatRole role,
                                 String content,
                                 @JsonProperty("created_at") OffsetDateTime createdAt,
                                 @JsonProperty("metadata_json") String metadataJson) {
    }
}
