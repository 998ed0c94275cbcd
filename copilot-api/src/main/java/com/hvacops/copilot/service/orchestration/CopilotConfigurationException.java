package com.hvacops.copilot.service.orchestration;

/**
 * No usable backend is configured.
 */
public class CopilotConfigurationException extends RuntimeException {

    public CopilotConfigurationException(String message) {
        super(message);
    }
}
