package com.hvacops.copilot.client.conversation;

/**
 * Lifecycle of one assistant turn. Every turn starts and ends in {@link #IDLE}; transitions are
 * defined in {@link TurnStateMachineConfig}.
 */
public enum TurnState {
    IDLE,
    SENDING,
    STREAMING,
    FINALIZING,
    FAILED
}
