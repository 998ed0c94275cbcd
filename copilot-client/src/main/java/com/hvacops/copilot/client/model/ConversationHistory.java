package com.hvacops.copilot.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationHistory(@JsonProperty("conversation_id") String conversationId,
                                  List<HistoryTurn> messages) {

    public ConversationHistory {
        messages = messages == null ? List.of() : messages;
    }

    public static ConversationHistory empty() {
        return new ConversationHistory(null, List.of());
    }
}
