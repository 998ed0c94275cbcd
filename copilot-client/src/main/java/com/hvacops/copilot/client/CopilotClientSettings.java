package com.hvacops.copilot.client;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Connection settings for the copilot backend. A blank {@code baseUrl} means no backend is
 * configured and the client answers from the offline responder.
 *
 * @param tokenSupplier returns the current bearer token, or null/blank when the user has none
 */
public record CopilotClientSettings(String baseUrl,
                                    String devTenantId,
                                    String devUserId,
                                    Duration timeout,
                                    Supplier<String> tokenSupplier) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public CopilotClientSettings {
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        tokenSupplier = tokenSupplier == null ? () -> null : tokenSupplier;
    }

    public static CopilotClientSettings offline() {
        return new CopilotClientSettings(null, null, null, DEFAULT_TIMEOUT, null);
    }

    public boolean hasBackend() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
