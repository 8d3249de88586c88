package com.ownmyhealth.phi.audit;

/**
 * Decrypted previous/new values of an audit record, as the JSON they were written as.
 */
public record AuditSnapshot(String auditLogId, String previousValue, String newValue) {
}
