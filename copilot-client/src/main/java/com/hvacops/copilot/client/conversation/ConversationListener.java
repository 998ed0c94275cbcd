package com.hvacops.copilot.client.conversation;

import java.util.List;

/**
 * Observer of a {@link JobConversation}. Callbacks run on the thread that caused the change,
 * while the conversation is locked, and receive immutable snapshots.
 */
public interface ConversationListener {

    default void onStateChanged(TurnState state) {
    }

    default void onMessagesChanged(List<DisplayMessage> messages) {
    }

    default void onFollowUpsChanged(List<String> followUps) {
    }
}
