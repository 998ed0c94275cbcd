package com.hvacops.copilot.service.orchestration;

public class ModelInvocationException extends RuntimeException {

    private final Integer status;
    private final String responseBody;

    public ModelInvocationException(String message) {
        this(message, null, null, null);
    }

    public ModelInvocationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ModelInvocationException(String message, Integer status, String responseBody, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody;
    }

    public Integer status() {
        return status;
    }

    public String responseBody() {
        return responseBody;
    }
}
