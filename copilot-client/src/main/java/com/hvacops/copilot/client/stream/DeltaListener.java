package com.hvacops.copilot.client.stream;

@FunctionalInterface
public interface DeltaListener {

    void onDelta(String delta);

    static DeltaListener ignoring() {
        return delta -> {
        };
    }
}
