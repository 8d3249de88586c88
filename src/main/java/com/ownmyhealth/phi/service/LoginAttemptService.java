package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.config.AuthSettings;
import com.ownmyhealth.phi.exception.NotFoundException;
import com.ownmyhealth.phi.model.User;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Per-account lockout state kept on the user document.
 *
 * Failures are counted with a server-side {@code $inc}, so concurrent wrong
 * passwords from many request threads never lose an increment. Lock expiry is
 * evaluated lazily: nothing runs when a lock lapses, the next attempt sees it.
 */
@Service
public class LoginAttemptService {
    private static final Logger log = LoggerFactory.getLogger(LoginAttemptService.class);
    private final MongoTemplate mongoTemplate;
    private final int maxAttempts;
    private final Duration lockoutDuration;
    private final Clock clock;

    public LoginAttemptService(MongoTemplate mongoTemplate, AuthSettings settings, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.maxAttempts = settings.maxLoginAttempts();
        this.lockoutDuration = settings.lockoutDuration();
        this.clock = clock;
    }

    public boolean isAccountLocked(User user) {
        Instant lockedUntil = user.getLockedUntil();
        return lockedUntil != null && lockedUntil.isAfter(this.clock.instant());
    }

    /**
     * Seconds until the lock lapses, rounded up; 0 when not locked.
     */
    public long getLockoutRemainingTime(User user) {
        Instant lockedUntil = user.getLockedUntil();
        if (lockedUntil == null) {
            return 0;
        }
        long millis = Duration.between(this.clock.instant(), lockedUntil).toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }

    public LockoutResult recordFailedLogin(User user) {
        Instant now = this.clock.instant();
        // A lapsed lock starts a fresh count instead of relocking on the next miss.
        this.mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(user.getId()).and("lockedUntil").lte(now)),
                new Update().set("failedLoginAttempts", 0).unset("lockedUntil"),
                User.class);
        User updated = this.mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(user.getId())),
                new Update().inc("failedLoginAttempts", 1).set("lastFailedLogin", now),
                FindAndModifyOptions.options().returnNew(true),
                User.class);
        if (updated == null) {
            throw new NotFoundException("User not found");
        }
        int attempts = updated.getFailedLoginAttempts();
        user.setFailedLoginAttempts(attempts);
        user.setLastFailedLogin(now);
        if (attempts >= this.maxAttempts) {
            Instant lockedUntil = now.plus(this.lockoutDuration);
            this.mongoTemplate.updateFirst(
                    Query.query(Criteria.where("_id").is(user.getId())),
                    Update.update("lockedUntil", lockedUntil),
                    User.class);
            user.setLockedUntil(lockedUntil);
            log.warn("Account {} locked until {} after {} failed attempts", user.getId(), lockedUntil, attempts);
            return new LockoutResult(true, 0, lockedUntil);
        }
        return new LockoutResult(false, this.maxAttempts - attempts, null);
    }

    /**
     * Clears the failure counter and any lock, and stamps the login time.
     */
    public void resetFailedLoginAttempts(User user) {
        Instant now = this.clock.instant();
        this.mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(user.getId())),
                new Update().set("failedLoginAttempts", 0).unset("lockedUntil").unset("lastFailedLogin").set("lastLoginAt", now),
                User.class);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastFailedLogin(null);
        user.setLastLoginAt(now);
    }

    public int getMaxAttempts() {
        return this.maxAttempts;
    }

    public Duration getLockoutDuration() {
        return this.lockoutDuration;
    }
}
