package com.hvacops.copilot.client.conversation;

import java.time.Instant;
import java.util.List;

public record DisplayMessage(String id,
                             Role role,
                             String content,
                             Instant timestamp,
                             String senderId,
                             String senderName,
                             boolean loading,
                             List<MessageSource> sources) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public DisplayMessage {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public DisplayMessage withContent(String newContent, boolean stillLoading) {
        return new DisplayMessage(id, role, newContent, timestamp, senderId, senderName, stillLoading, sources);
    }

    public DisplayMessage resolved(String finalContent, List<MessageSource> finalSources) {
        return new DisplayMessage(id, role, finalContent, Instant.now(), senderId, senderName, false, finalSources);
    }
}
