package com.hvacops.copilot.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Writes orchestration events to the log and records request outcome metrics.
 */
@Component
public class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);
    private static final String REQUEST_METRIC = "copilot.requests";
    private static final String LATENCY_METRIC = "copilot.latency";

    private final MeterRegistry meterRegistry;

    public LoggingTelemetrySink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void emit(TelemetryEvent event) {
        switch (event.name()) {
            case TelemetryEvent.REQUEST_FAILED -> {
                log.warn("copilot {} requestId={} payload={}", event.name(), event.requestId(), event.payload());
                meterRegistry.counter(REQUEST_METRIC, "outcome", "failure").increment();
            }
            case TelemetryEvent.REQUEST_COMPLETED -> {
                log.info("copilot {} requestId={} payload={}", event.name(), event.requestId(), event.payload());
                meterRegistry.counter(REQUEST_METRIC, "outcome", "success").increment();
                Object latency = event.payload().get("latencyMs");
                if (latency instanceof Number number) {
                    meterRegistry.timer(LATENCY_METRIC).record(Duration.ofMillis(number.longValue()));
                }
            }
            default -> log.debug("copilot {} requestId={} payload={}", event.name(), event.requestId(), event.payload());
        }
    }
}
