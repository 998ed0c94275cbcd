package com.hvacops.copilot.prompt;

import com.hvacops.copilot.model.ChatMessage;

import java.util.List;
import java.util.Map;

public record PromptContext(Map<String, Object> snapshot,
                            String evidenceText,
                            List<ChatMessage> history,
                            String userMessage) {
}
