package com.hvacops.copilot.client.conversation;

public record Participant(String id, String name) {

    public static final Participant COPILOT = new Participant("ai", "HVACOps Copilot");
}
