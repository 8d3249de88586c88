package com.ownmyhealth.phi.service;

import com.mongodb.client.result.UpdateResult;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuditMetadata;
import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.crypto.PhiFields;
import com.ownmyhealth.phi.exception.NotFoundException;
import com.ownmyhealth.phi.model.AuditAction;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Lifecycle of the per-user salt: lazy creation, lookup and rotation.
 * The salt is stored on the user document encrypted with the master key.
 */
@Service
public class UserSaltService {
    private static final Logger log = LoggerFactory.getLogger(UserSaltService.class);
    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;
    private final EncryptionService encryptionService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public UserSaltService(UserRepository userRepository, MongoTemplate mongoTemplate, EncryptionService encryptionService,
            AuditLogService auditLogService, Clock clock) {
        this.userRepository = userRepository;
        this.mongoTemplate = mongoTemplate;
        this.encryptionService = encryptionService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public boolean hasSalt(User user) {
        return user.getEncryptedSalt() != null && !user.getEncryptedSalt().isEmpty();
    }

    /**
     * Returns the user's salt, creating it on first use. When two requests race to
     * create it, the first write wins and the loser reads the winner's salt back.
     */
    public String getOrCreateSalt(User user) {
        if (this.hasSalt(user)) {
            return this.encryptionService.decryptWithMasterKey(user.getEncryptedSalt());
        }
        String salt = this.encryptionService.generateUserSalt();
        String encrypted = this.encryptionService.encryptWithMasterKey(salt);
        UpdateResult result = this.mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(user.getId()).and("encryptedSalt").is(null)),
                new Update().set("encryptedSalt", encrypted).set("saltVersion", 1),
                User.class);
        if (result.getModifiedCount() == 0) {
            User current = this.userRepository.findById(user.getId()).orElseThrow(() -> new NotFoundException("User not found"));
            if (!this.hasSalt(current)) {
                throw new IllegalStateException("User salt could not be stored");
            }
            user.setEncryptedSalt(current.getEncryptedSalt());
            user.setSaltVersion(current.getSaltVersion());
            return this.encryptionService.decryptWithMasterKey(current.getEncryptedSalt());
        }
        user.setEncryptedSalt(encrypted);
        user.setSaltVersion(1);
        log.debug("Created encryption salt for user {}", user.getId());
        return salt;
    }

    /**
     * Moves the user's profile PHI to a fresh salt and bumps the salt version.
     * Plaintext exists only inside {@link EncryptionService#reEncrypt}.
     */
    public User rotateSalt(String userId) {
        User user = this.userRepository.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        if (!this.hasSalt(user)) {
            this.getOrCreateSalt(user);
            return user;
        }
        String oldSalt = this.encryptionService.decryptWithMasterKey(user.getEncryptedSalt());
        String newSalt = this.encryptionService.generateUserSalt();
        Map<String, Object> fields = ProfileFields.read(user);
        Map<String, Object> rotated = new LinkedHashMap<>(fields);
        for (String field : PhiFields.USER) {
            if (fields.get(field) instanceof String value && !value.isEmpty()) {
                rotated.put(field, this.encryptionService.reEncrypt(value, oldSalt, newSalt));
            }
        }
        Instant now = this.clock.instant();
        String sealedSalt = this.encryptionService.encryptWithMasterKey(newSalt);
        int version = user.getSaltVersion() + 1;
        // Guarded by the salt we read: a concurrent rotation makes this one fail.
        UpdateResult result = this.mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(userId).and("encryptedSalt").is(user.getEncryptedSalt())),
                ProfileFields.toUpdate(rotated).set("encryptedSalt", sealedSalt).set("saltVersion", version)
                        .set("saltRotatedAt", now).set("updatedAt", now),
                User.class);
        if (result.getModifiedCount() == 0) {
            throw new IllegalStateException("Encryption salt changed during rotation for user " + userId);
        }
        ProfileFields.write(user, rotated);
        user.setEncryptedSalt(sealedSalt);
        user.setSaltVersion(version);
        user.setSaltRotatedAt(now);
        user.setUpdatedAt(now);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("saltVersion", version);
        this.auditLogService.logSystem(AuditAction.KEY_ROTATION, "User", userId,
                new AuditMetadata.SystemMetadata("user_salt_rotation", details));
        log.info("Rotated encryption salt for user {} to version {}", userId, version);
        return user;
    }
}
