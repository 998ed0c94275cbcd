package com.hvacops.copilot.service.orchestration;

/**
 * A completion backend. Implementations must be safe to call from multiple threads.
 */
public interface ModelProvider {

    ModelCompletion complete(ModelRequest request);

    default String name() {
        return getClass().getSimpleName();
    }
}
