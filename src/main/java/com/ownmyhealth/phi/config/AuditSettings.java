package com.ownmyhealth.phi.config;

/**
 * Immutable audit policy from {@code app.audit.*}.
 */
public record AuditSettings(int retentionDays, int userAgentMaxLength, int exportIdLimit) {

    public AuditSettings {
        if (retentionDays < 1) {
            throw new IllegalStateException("app.audit.retention-days must be positive");
        }
    }

    public static AuditSettings defaults() {
        return new AuditSettings(2555, 500, 100);
    }
}
