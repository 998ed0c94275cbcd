package com.hvacops.copilot.security;

/**
 * Tenant and user a request acts for.
 */
public record RequestIdentity(String tenantId, String userId) {
}
