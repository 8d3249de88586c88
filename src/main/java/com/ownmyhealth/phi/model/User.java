package com.ownmyhealth.phi.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Account record. Profile PHI is only ever held in the {@code *Encrypted}
 * fields, sealed under the user's own salt.
 */
@Document(collection="users")
public class User {
    @Id
    private String id;
    @Indexed(unique=true)
    private String email;
    private String passwordHash;
    private UserRole role = UserRole.PATIENT;
    private boolean active = true;
    private boolean emailVerified = false;
    @Indexed(unique=true, sparse=true)
    private String emailVerificationToken;
    private Instant emailVerificationExpires;
    @Indexed(unique=true, sparse=true)
    private String passwordResetToken;
    private Instant passwordResetExpires;
    private int failedLoginAttempts = 0;
    private Instant lockedUntil;
    private Instant lastFailedLogin;
    private Instant lastLoginAt;
    private Instant createdAt;
    private Instant updatedAt;
    private String encryptedSalt;
    private int saltVersion = 0;
    private Instant saltRotatedAt;
    private String firstNameEncrypted;
    private String lastNameEncrypted;
    private String dateOfBirthEncrypted;
    private String phoneEncrypted;
    private String addressEncrypted;

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return this.email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return this.passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public UserRole getRole() {
        return this.role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public boolean isActive() {
        return this.active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isEmailVerified() {
        return this.emailVerified;
    }

    public void setEmailVerified(boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public String getEmailVerificationToken() {
        return this.emailVerificationToken;
    }

    public void setEmailVerificationToken(String emailVerificationToken) {
        this.emailVerificationToken = emailVerificationToken;
    }

    public Instant getEmailVerificationExpires() {
        return this.emailVerificationExpires;
    }

    public void setEmailVerificationExpires(Instant emailVerificationExpires) {
        this.emailVerificationExpires = emailVerificationExpires;
    }

    public String getPasswordResetToken() {
        return this.passwordResetToken;
    }

    public void setPasswordResetToken(String passwordResetToken) {
        this.passwordResetToken = passwordResetToken;
    }

    public Instant getPasswordResetExpires() {
        return this.passwordResetExpires;
    }

    public void setPasswordResetExpires(Instant passwordResetExpires) {
        this.passwordResetExpires = passwordResetExpires;
    }

    public int getFailedLoginAttempts() {
        return this.failedLoginAttempts;
    }

    public void setFailedLoginAttempts(int failedLoginAttempts) {
        this.failedLoginAttempts = failedLoginAttempts;
    }

    public Instant getLockedUntil() {
        return this.lockedUntil;
    }

    public void setLockedUntil(Instant lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    public Instant getLastFailedLogin() {
        return this.lastFailedLogin;
    }

    public void setLastFailedLogin(Instant lastFailedLogin) {
        this.lastFailedLogin = lastFailedLogin;
    }

    public Instant getLastLoginAt() {
        return this.lastLoginAt;
    }

    public void setLastLoginAt(Instant lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return this.updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getEncryptedSalt() {
        return this.encryptedSalt;
    }

    public void setEncryptedSalt(String encryptedSalt) {
        this.encryptedSalt = encryptedSalt;
    }

    public int getSaltVersion() {
        return this.saltVersion;
    }

    public void setSaltVersion(int saltVersion) {
        this.saltVersion = saltVersion;
    }

    public Instant getSaltRotatedAt() {
        return this.saltRotatedAt;
    }

    public void setSaltRotatedAt(Instant saltRotatedAt) {
        this.saltRotatedAt = saltRotatedAt;
    }

    public String getFirstNameEncrypted() {
        return this.firstNameEncrypted;
    }

    public void setFirstNameEncrypted(String firstNameEncrypted) {
        this.firstNameEncrypted = firstNameEncrypted;
    }

    public String getLastNameEncrypted() {
        return this.lastNameEncrypted;
    }

    public void setLastNameEncrypted(String lastNameEncrypted) {
        this.lastNameEncrypted = lastNameEncrypted;
    }

    public String getDateOfBirthEncrypted() {
        return this.dateOfBirthEncrypted;
    }

    public void setDateOfBirthEncrypted(String dateOfBirthEncrypted) {
        this.dateOfBirthEncrypted = dateOfBirthEncrypted;
    }

    public String getPhoneEncrypted() {
        return this.phoneEncrypted;
    }

    public void setPhoneEncrypted(String phoneEncrypted) {
        this.phoneEncrypted = phoneEncrypted;
    }

    public String getAddressEncrypted() {
        return this.addressEncrypted;
    }

    public void setAddressEncrypted(String addressEncrypted) {
        this.addressEncrypted = addressEncrypted;
    }

    @Override
    public String toString() {
        return "User{id=" + this.id + ", role=" + this.role + ", active=" + this.active + "}";
    }
}
