package com.hvacops.copilot.controller;

import com.hvacops.copilot.service.orchestration.CopilotConfigurationException;
import com.hvacops.copilot.service.orchestration.ModelInvocationException;
import com.hvacops.copilot.service.orchestration.ResponseParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    static final String MISSING_MESSAGE = "Missing message";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception) {
        String message = exception.getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .filter(text -> text != null && !text.isBlank())
                .findFirst()
                .orElse(MISSING_MESSAGE);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(ServerWebInputException exception) {
        log.debug("Rejected chat request body: {}", exception.getReason());
        return error(HttpStatus.BAD_REQUEST, MISSING_MESSAGE);
    }

    @ExceptionHandler({ResponseParseException.class, ModelInvocationException.class})
    public ResponseEntity<Map<String, Object>> handleModelFailure(RuntimeException exception) {
        log.error("Copilot request failed", exception);
        return error(HttpStatus.BAD_GATEWAY, exception.getMessage());
    }

    @ExceptionHandler(CopilotConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(CopilotConfigurationException exception) {
        log.error("Copilot is not configured: {}", exception.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, exception.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
