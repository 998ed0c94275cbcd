package com.hvacops.copilot.client.stream;

import com.hvacops.copilot.client.model.CopilotReply;

public record DecodedFrame(Kind kind, String delta, CopilotReply reply) {

    public enum Kind {
        DELTA,
        TERMINAL,
        SKIP,
        UNPARSEABLE
    }

    private static final DecodedFrame SKIP = new DecodedFrame(Kind.SKIP, null, null);
    private static final DecodedFrame UNPARSEABLE = new DecodedFrame(Kind.UNPARSEABLE, null, null);

    public static DecodedFrame delta(String delta) {
        return new DecodedFrame(Kind.DELTA, delta, null);
    }

    public static DecodedFrame terminal(CopilotReply reply) {
        return new DecodedFrame(Kind.TERMINAL, null, reply);
    }

    public static DecodedFrame skip() {
        return SKIP;
    }

    public static DecodedFrame unparseable() {
        return UNPARSEABLE;
    }
}
