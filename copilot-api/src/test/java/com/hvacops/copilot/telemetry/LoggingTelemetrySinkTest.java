package com.hvacops.copilot.telemetry;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingTelemetrySinkTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final LoggingTelemetrySink sink = new LoggingTelemetrySink(meterRegistry);

    @Test
    void countsOutcomesAndRecordsLatency() {
        sink.emit(new TelemetryEvent(TelemetryEvent.REQUEST_STARTED, "r1", Instant.now(), Map.of()));
        sink.emit(new TelemetryEvent(TelemetryEvent.REQUEST_COMPLETED, "r1", Instant.now(), Map.of("latencyMs", 42L)));
        sink.emit(new TelemetryEvent(TelemetryEvent.REQUEST_FAILED, "r2", Instant.now(), Map.of("error", "boom")));

        assertThat(meterRegistry.counter("copilot.requests", "outcome", "success").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("copilot.requests", "outcome", "failure").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("copilot.latency").count()).isEqualTo(1);
    }
}
