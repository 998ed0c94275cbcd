package com.hvacops.copilot.model;

import jakarta.validation.constraints.NotBlank;

public record ChatSubmission(@NotBlank(message = "Missing message") String message,
                             String conversationId,
                             Boolean stream) {
}
