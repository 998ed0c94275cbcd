package com.hvacops.copilot.model;

import java.util.List;
import java.util.Map;

/**
 * Everything one orchestration attempt needs. {@code requestId} correlates telemetry.
 */
public record CopilotRequest(String requestId,
                             Map<String, Object> context,
                             String evidenceText,
                             List<ChatMessage> history,
                             String userInput,
                             CopilotConfig config) {

    public CopilotRequest {
        history = history == null ? List.of() : history;
        config = config == null ? CopilotConfig.defaults() : config;
    }
}
