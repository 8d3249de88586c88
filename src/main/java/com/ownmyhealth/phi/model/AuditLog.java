package com.ownmyhealth.phi.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Append-only audit record. Value snapshots are stored encrypted under the
 * audit salt; {@code metadata} is the JSON form of an
 * {@link com.ownmyhealth.phi.audit.AuditMetadata} and never carries PHI.
 */
@Document(collection="audit_logs")
public class AuditLog {
    @Id
    private String id;
    @Indexed
    private String userId;
    private ActorType actorType;
    private String ipAddress;
    private String userAgent;
    private String sessionId;
    @Indexed
    private String correlationId;
    @Indexed
    private AuditAction action;
    @Indexed
    private String resourceType;
    private String resourceId;
    private String previousValueEncrypted;
    private String newValueEncrypted;
    private String metadata;
    private boolean success = true;
    private String errorMessage;
    @Indexed
    private Instant createdAt;

    public static AuditLog create(AuditAction action, ActorType actorType, String resourceType) {
        AuditLog log = new AuditLog();
        log.action = action;
        log.actorType = actorType;
        log.resourceType = resourceType;
        return log;
    }

    public AuditLog withActor(String userId, String ipAddress, String userAgent) {
        this.userId = userId;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        return this;
    }

    public AuditLog withResourceId(String resourceId) {
        this.resourceId = resourceId;
        return this;
    }

    public AuditLog withSnapshots(String previousValueEncrypted, String newValueEncrypted) {
        this.previousValueEncrypted = previousValueEncrypted;
        this.newValueEncrypted = newValueEncrypted;
        return this;
    }

    public AuditLog withMetadata(String metadataJson) {
        this.metadata = metadataJson;
        return this;
    }

    public AuditLog withOutcome(boolean success, String errorMessage) {
        this.success = success;
        this.errorMessage = errorMessage;
        return this;
    }

    public AuditLog at(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return this.userId;
    }

    public ActorType getActorType() {
        return this.actorType;
    }

    public String getIpAddress() {
        return this.ipAddress;
    }

    public String getUserAgent() {
        return this.userAgent;
    }

    public String getSessionId() {
        return this.sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getCorrelationId() {
        return this.correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
    }

    public AuditAction getAction() {
        return this.action;
    }

    public String getResourceType() {
        return this.resourceType;
    }

    public String getResourceId() {
        return this.resourceId;
    }

    public String getPreviousValueEncrypted() {
        return this.previousValueEncrypted;
    }

    public String getNewValueEncrypted() {
        return this.newValueEncrypted;
    }

    public String getMetadata() {
        return this.metadata;
    }

    public boolean isSuccess() {
        return this.success;
    }

    public String getErrorMessage() {
        return this.errorMessage;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }
}
