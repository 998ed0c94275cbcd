package com.hvacops.copilot.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "copilot.security")
public class SecurityProperties {

    /**
     * Bearer token required on /jobs/** when set. Without it requests are accepted as-is.
     */
    private String staticToken;

    private String defaultTenantId = "dev-tenant";

    private String defaultUserId = "dev-user";

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public String getDefaultTenantId() {
        return defaultTenantId;
    }

    public void setDefaultTenantId(String defaultTenantId) {
        this.defaultTenantId = defaultTenantId;
    }

    public String getDefaultUserId() {
        return defaultUserId;
    }

    public void setDefaultUserId(String defaultUserId) {
        this.defaultUserId = defaultUserId;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }
}
