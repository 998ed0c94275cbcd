package com.hvacops.copilot.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryTurn(String role,
                          String content,
                          @JsonProperty("created_at") String createdAt,
                          @JsonProperty("metadata_json") String metadataJson) {

    public boolean isAssistant() {
        return "assistant".equalsIgnoreCase(role);
    }
}
