package com.hvacops.copilot.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TelemetryEvent(String name,
                             String requestId,
                             Instant timestamp,
                             Map<String, Object> payload) {

    public static final String REQUEST_STARTED = "request.started";
    public static final String MODEL_COMPLETED = "model.completed";
    public static final String RESPONSE_PARSED = "response.parsed";
    public static final String REQUEST_COMPLETED = "request.completed";
    public static final String REQUEST_FAILED = "request.failed";

    public TelemetryEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
