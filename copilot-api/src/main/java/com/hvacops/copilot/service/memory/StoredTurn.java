package com.hvacops.copilot.service.memory;

import com.hvacops.copilot.model.ChatRole;

import java.time.OffsetDateTime;

public record StoredTurn(ChatRole role, String content, OffsetDateTime createdAt, String metadataJson) {
}
