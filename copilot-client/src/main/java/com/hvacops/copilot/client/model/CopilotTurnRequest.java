package com.hvacops.copilot.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CopilotTurnRequest(String message, String conversationId, Boolean stream) {

    public static CopilotTurnRequest of(String message, String conversationId) {
        return new CopilotTurnRequest(message, conversationId, null);
    }

    public CopilotTurnRequest streaming() {
        return new CopilotTurnRequest(message, conversationId, Boolean.TRUE);
    }
}
