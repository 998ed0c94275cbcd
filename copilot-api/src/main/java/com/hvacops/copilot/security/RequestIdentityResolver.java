package com.hvacops.copilot.security;

import org.springframework.stereotype.Component;

/**
 * Resolves tenant and user from the development headers, falling back to configured defaults.
 */
@Component
public class RequestIdentityResolver {

    public static final String TENANT_HEADER = "x-tenant-id";
    public static final String USER_HEADER = "x-user-id";

    private final SecurityProperties securityProperties;

    public RequestIdentityResolver(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public RequestIdentity resolve(String tenantHeader, String userHeader) {
        return new RequestIdentity(
                firstNonBlank(tenantHeader, securityProperties.getDefaultTenantId()),
                firstNonBlank(userHeader, securityProperties.getDefaultUserId())
        );
    }

    private String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
