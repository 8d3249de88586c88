package com.ownmyhealth.phi.audit;

import com.ownmyhealth.phi.model.AuditAction;

/**
 * Authentication lifecycle events and the audit action each one is stored under.
 */
public enum AuthEvent {
    LOGIN(AuditAction.LOGIN, true),
    LOGIN_FAILED(AuditAction.LOGIN, false),
    LOGOUT(AuditAction.LOGOUT, true),
    REGISTER(AuditAction.CREATE, true),
    PASSWORD_CHANGE(AuditAction.UPDATE, true),
    PASSWORD_RESET_REQUEST(AuditAction.UPDATE, true),
    PASSWORD_RESET_COMPLETE(AuditAction.UPDATE, true),
    PASSWORD_RESET_FAILED(AuditAction.UPDATE, false),
    EMAIL_VERIFICATION(AuditAction.UPDATE, true),
    EMAIL_VERIFICATION_FAILED(AuditAction.UPDATE, false),
    ACCOUNT_LOCKOUT(AuditAction.UPDATE, false);

    private final AuditAction action;
    private final boolean success;

    private AuthEvent(AuditAction action, boolean success) {
        this.action = action;
        this.success = success;
    }

    public AuditAction getAction() {
        return this.action;
    }

    public boolean isSuccess() {
        return this.success;
    }
}
