package com.ownmyhealth.phi.exception;

/**
 * Internal to the audit pipeline. Always caught inside the audit service and
 * never surfaced to business callers.
 */
public class AuditWriteException extends PhiCoreException {
    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
