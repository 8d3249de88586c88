package com.ownmyhealth.phi.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Server-side record of one issued refresh token. The id is the token's
 * {@code jti}; the token itself is never stored, only a short fingerprint.
 */
@Document(collection="sessions")
public class Session {
    @Id
    private String id;
    @Indexed
    private String userId;
    private String tokenFingerprint;
    @Indexed
    private Instant expiresAt;
    private Instant createdAt;
    private String ipAddress;
    private String userAgent;

    public Session() {
    }

    public Session(String id, String userId, String tokenFingerprint, Instant expiresAt, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.tokenFingerprint = tokenFingerprint;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    public Session withClient(String ipAddress, String userAgent) {
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        return this;
    }

    public boolean isExpired(Instant now) {
        return this.expiresAt == null || !this.expiresAt.isAfter(now);
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

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTokenFingerprint() {
        return this.tokenFingerprint;
    }

    public void setTokenFingerprint(String tokenFingerprint) {
        this.tokenFingerprint = tokenFingerprint;
    }

    public Instant getExpiresAt() {
        return this.expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getIpAddress() {
        return this.ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return this.userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
