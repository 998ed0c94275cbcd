package com.hvacops.copilot.service.orchestration;

public class ResponseParseException extends RuntimeException {

    public ResponseParseException(String message) {
        super(message);
    }
}
