package com.hvacops.copilot.client.conversation;

public enum TurnEvent {
    SEND,
    DELTA,
    TERMINAL,
    ERROR,
    RESET
}
