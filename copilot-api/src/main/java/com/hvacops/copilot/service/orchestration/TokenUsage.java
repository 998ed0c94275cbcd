package com.hvacops.copilot.service.orchestration;

public record TokenUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {
}
