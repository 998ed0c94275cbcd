package com.hvacops.copilot.service.orchestration;

import com.hvacops.copilot.model.ChatMessage;

import java.util.List;

public record ModelRequest(String model,
                           double temperature,
                           Double topP,
                           Integer maxTokens,
                           String responseFormat,
                           List<ChatMessage> messages) {
}
