package com.ownmyhealth.phi.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Map;

/**
 * Structured, PHI-free context attached to an audit record. Stored as JSON with a
 * {@code kind} discriminator so each record can be read back into its variant.
 */
@JsonTypeInfo(use=JsonTypeInfo.Id.NAME, property="kind")
@JsonSubTypes(value={
        @JsonSubTypes.Type(value=AuditMetadata.AccessMetadata.class, name="access"),
        @JsonSubTypes.Type(value=AuditMetadata.AuthMetadata.class, name="auth"),
        @JsonSubTypes.Type(value=AuditMetadata.ExportMetadata.class, name="export"),
        @JsonSubTypes.Type(value=AuditMetadata.SystemMetadata.class, name="system"),
        @JsonSubTypes.Type(value=AuditMetadata.ChangeMetadata.class, name="change")})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface AuditMetadata {

    /**
     * Read of a resource. {@code details} holds identifiers and counts only.
     */
    record AccessMetadata(String purpose, Map<String, String> details) implements AuditMetadata {
    }

    /**
     * Authentication event. The subject email is recorded as a keyed hash so
     * attempts against one address can be correlated without storing it.
     */
    record AuthMetadata(AuthEvent event, String emailHash, String reason) implements AuditMetadata {
    }

    record ExportMetadata(String format, int totalCount, List<String> resourceIds, boolean truncated) implements AuditMetadata {
    }

    record SystemMetadata(String operation, Map<String, Object> details) implements AuditMetadata {
    }

    /**
     * Names of the fields that differ between the snapshots; never their values.
     */
    record ChangeMetadata(List<String> changedFields) implements AuditMetadata {
    }
}
