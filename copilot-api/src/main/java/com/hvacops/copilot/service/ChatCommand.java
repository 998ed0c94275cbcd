package com.hvacops.copilot.service;

import com.hvacops.copilot.security.RequestIdentity;

public record ChatCommand(RequestIdentity identity,
                          String jobId,
                          String message,
                          String conversationId,
                          boolean debug) {
}
