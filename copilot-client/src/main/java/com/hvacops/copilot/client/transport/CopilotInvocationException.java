package com.hvacops.copilot.client.transport;

/**
 * Non-2xx answer from the copilot backend. The message is the response body as sent.
 */
public class CopilotInvocationException extends RuntimeException {

    private final int status;

    public CopilotInvocationException(int status, String responseBody) {
        super(responseBody == null || responseBody.isBlank() ? "HTTP " + status : responseBody);
        this.status = status;
    }

    public CopilotInvocationException(String message) {
        super(message);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
