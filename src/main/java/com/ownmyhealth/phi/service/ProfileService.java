package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.audit.AuditContext;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuditMetadata;
import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.crypto.PhiFields;
import com.ownmyhealth.phi.exception.NotFoundException;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Reads and writes the user's profile PHI. Values are sealed under the user's
 * own salt before they reach the store, and every read and write is audited.
 */
@Service
public class ProfileService {
    static final String RESOURCE_TYPE = "UserProfile";
    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;
    private final UserSaltService userSaltService;
    private final EncryptionService encryptionService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ProfileService(UserRepository userRepository, MongoTemplate mongoTemplate, UserSaltService userSaltService,
            EncryptionService encryptionService, AuditLogService auditLogService, Clock clock) {
        this.userRepository = userRepository;
        this.mongoTemplate = mongoTemplate;
        this.userSaltService = userSaltService;
        this.encryptionService = encryptionService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public UserProfile getProfile(String userId, AuditContext context) {
        User user = this.userRepository.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        UserProfile profile = this.decrypt(user);
        this.auditLogService.logAccess(RESOURCE_TYPE, userId, context,
                new AuditMetadata.AccessMetadata("profile_view", Map.of("saltVersion", String.valueOf(user.getSaltVersion()))));
        return profile;
    }

    /**
     * Replaces the whole profile. Null fields clear the stored value. Only the
     * profile columns are written, so concurrent lockout updates survive.
     */
    public UserProfile updateProfile(String userId, UserProfile profile, AuditContext context) {
        User user = this.userRepository.findById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        UserProfile previous = this.decrypt(user);
        String salt = this.userSaltService.getOrCreateSalt(user);
        Map<String, Object> encrypted = this.encryptionService.encryptFields(profile.toEncryptableFields(), PhiFields.USER, salt);
        Instant now = this.clock.instant();
        this.mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(userId)),
                ProfileFields.toUpdate(encrypted).set("updatedAt", now), User.class);
        ProfileFields.write(user, encrypted);
        user.setUpdatedAt(now);
        this.auditLogService.logUpdate(RESOURCE_TYPE, userId, previous, profile, context);
        return profile;
    }

    private UserProfile decrypt(User user) {
        if (!this.userSaltService.hasSalt(user)) {
            return new UserProfile(null, null, null, null, null);
        }
        String salt = this.userSaltService.getOrCreateSalt(user);
        return UserProfile.fromDecryptedFields(this.encryptionService.decryptFields(ProfileFields.read(user), PhiFields.USER, salt));
    }
}
