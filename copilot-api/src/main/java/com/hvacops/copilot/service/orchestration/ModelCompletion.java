package com.hvacops.copilot.service.orchestration;

/**
 * Raw model output. {@code content} is untrusted; {@code usage} may be null.
 */
public record ModelCompletion(String content, TokenUsage usage) {

    public static ModelCompletion of(String content) {
        return new ModelCompletion(content, null);
    }
}
