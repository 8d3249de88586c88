package com.ownmyhealth.phi.audit;

/**
 * Who performed an audited operation, from where, and under which request
 * correlation id. Every field may be null.
 */
public record AuditContext(String userId, String ipAddress, String userAgent, String sessionId, String correlationId) {

    public static AuditContext system() {
        return new AuditContext(null, null, null, null, null);
    }

    public static AuditContext ofUser(String userId) {
        return new AuditContext(userId, null, null, null, null);
    }

    public AuditContext withUser(String userId) {
        return new AuditContext(userId, this.ipAddress, this.userAgent, this.sessionId, this.correlationId);
    }

    public AuditContext withSession(String sessionId) {
        return new AuditContext(this.userId, this.ipAddress, this.userAgent, sessionId, this.correlationId);
    }

    public boolean hasUser() {
        return this.userId != null && !this.userId.isBlank();
    }
}
