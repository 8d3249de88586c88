package com.ownmyhealth.phi.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="system_config")
public class SystemConfig {
    @Id
    private String id;
    @Indexed(unique=true)
    private String key;
    private String value;
    private String valueType = "string";
    private String description;
    private boolean encrypted;
    private Instant createdAt;
    private Instant updatedAt;

    public SystemConfig() {
    }

    public SystemConfig(String key, String value, String description, boolean encrypted, Instant now) {
        this.key = key;
        this.value = value;
        this.description = description;
        this.encrypted = encrypted;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public String getId() {
        return this.id;
    }

    public String getKey() {
        return this.key;
    }

    public String getValue() {
        return this.value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getValueType() {
        return this.valueType;
    }

    public String getDescription() {
        return this.description;
    }

    public boolean isEncrypted() {
        return this.encrypted;
    }

    public void setEncrypted(boolean encrypted) {
        this.encrypted = encrypted;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public Instant getUpdatedAt() {
        return this.updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
