package com.hvacops.copilot.telemetry;

@FunctionalInterface
public interface TelemetrySink {

    void emit(TelemetryEvent event);

    static TelemetrySink noop() {
        return event -> {
        };
    }
}
