package com.ownmyhealth.phi.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ownmyhealth.phi.config.AuditSettings;
import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.exception.AuditWriteException;
import com.ownmyhealth.phi.filter.CorrelationIdFilter;
import com.ownmyhealth.phi.model.ActorType;
import com.ownmyhealth.phi.model.AuditAction;
import com.ownmyhealth.phi.model.AuditLog;
import com.ownmyhealth.phi.model.SystemConfig;
import com.ownmyhealth.phi.repository.AuditLogRepository;
import com.ownmyhealth.phi.repository.SystemConfigRepository;
import com.ownmyhealth.phi.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * HIPAA audit trail for PHI access, mutation and authentication events.
 *
 * Value snapshots are serialised to JSON and encrypted under a process-wide
 * audit salt, which is itself stored master-key encrypted in {@code system_config}.
 * Metadata is typed ({@link AuditMetadata}) and never carries PHI.
 *
 * Every {@code log*} method is best-effort: a failure is logged at ERROR and
 * swallowed so that auditing can never break the operation being audited.
 */
@Service
public class AuditLogService {
    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);
    public static final String AUDIT_SALT_KEY = "audit_encryption_salt";
    public static final String ENCRYPTION_FAILED = "[ENCRYPTION_FAILED]";
    private static final Pattern SALT_FORMAT = Pattern.compile("^[0-9a-f]{64}$");

    private final AuditLogRepository auditLogRepository;
    private final SystemConfigRepository systemConfigRepository;
    private final MongoTemplate mongoTemplate;
    private final EncryptionService encryptionService;
    private final ObjectMapper objectMapper;
    private final ClientIpResolver clientIpResolver;
    private final AuditSettings settings;
    private final Clock clock;
    private volatile String auditSalt;

    public AuditLogService(AuditLogRepository auditLogRepository, SystemConfigRepository systemConfigRepository,
            MongoTemplate mongoTemplate, EncryptionService encryptionService, ObjectMapper objectMapper,
            ClientIpResolver clientIpResolver, AuditSettings settings, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.systemConfigRepository = systemConfigRepository;
        this.mongoTemplate = mongoTemplate;
        this.encryptionService = encryptionService;
        this.objectMapper = objectMapper;
        this.clientIpResolver = clientIpResolver;
        this.settings = settings;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeOnStartup() {
        this.initialize();
    }

    /**
     * Loads the audit salt, generating and persisting one on first run.
     * A salt that cannot be decrypted or has the wrong shape stops the service.
     */
    public synchronized void initialize() {
        Optional<SystemConfig> existing = this.systemConfigRepository.findByKey(AUDIT_SALT_KEY);
        String salt;
        if (existing.isEmpty()) {
            salt = this.encryptionService.generateUserSalt();
            this.systemConfigRepository.save(new SystemConfig(AUDIT_SALT_KEY, this.encryptionService.encryptWithMasterKey(salt),
                    "Salt used for encrypting audit log values", true, this.clock.instant()));
            log.info("Generated new audit encryption salt");
        } else {
            SystemConfig config = existing.get();
            if (config.isEncrypted()) {
                try {
                    salt = this.encryptionService.decryptWithMasterKey(config.getValue());
                } catch (RuntimeException e) {
                    throw new IllegalStateException("FATAL: Audit encryption salt cannot be decrypted with the configured master key", e);
                }
            } else {
                salt = config.getValue();
                if (salt != null && SALT_FORMAT.matcher(salt).matches()) {
                    config.setValue(this.encryptionService.encryptWithMasterKey(salt));
                    config.setEncrypted(true);
                    config.setUpdatedAt(this.clock.instant());
                    this.systemConfigRepository.save(config);
                    log.info("Upgraded stored audit salt to master-key encryption");
                }
            }
        }
        if (salt == null || !SALT_FORMAT.matcher(salt).matches()) {
            throw new IllegalStateException("FATAL: Invalid audit encryption salt. Audit logging requires a 256-bit hex salt.");
        }
        this.auditSalt = salt;
        log.info("Audit logging service initialized");
    }

    public boolean isInitialized() {
        return this.auditSalt != null;
    }

    public AuditContext extractContext(HttpServletRequest request) {
        String userAgent = request.getHeader("User-Agent");
        if (userAgent != null && userAgent.length() > this.settings.userAgentMaxLength()) {
            userAgent = userAgent.substring(0, this.settings.userAgentMaxLength());
        }
        return new AuditContext(null, this.clientIpResolver.resolveClientIp(request), userAgent, null,
                CorrelationIdFilter.currentId(request));
    }

    public void logAccess(String resourceType, String resourceId, AuditContext context, AuditMetadata metadata) {
        this.record(() -> this.entry(AuditAction.READ, actorFor(context), resourceType, context)
                .withResourceId(resourceId)
                .withMetadata(this.toJson(metadata)));
    }

    public void logCreate(String resourceType, String resourceId, Object newValue, AuditContext context) {
        this.record(() -> this.entry(AuditAction.CREATE, actorFor(context), resourceType, context)
                .withResourceId(resourceId)
                .withSnapshots(null, this.encryptSnapshot(newValue)));
    }

    public void logUpdate(String resourceType, String resourceId, Object previousValue, Object newValue, AuditContext context) {
        this.record(() -> this.entry(AuditAction.UPDATE, actorFor(context), resourceType, context)
                .withResourceId(resourceId)
                .withSnapshots(this.encryptSnapshot(previousValue), this.encryptSnapshot(newValue))
                .withMetadata(this.toJson(new AuditMetadata.ChangeMetadata(this.changedFields(previousValue, newValue)))));
    }

    public void logDelete(String resourceType, String resourceId, Object previousValue, AuditContext context) {
        this.record(() -> this.entry(AuditAction.DELETE, actorFor(context), resourceType, context)
                .withResourceId(resourceId)
                .withSnapshots(this.encryptSnapshot(previousValue), null));
    }

    public void logAuth(AuthEvent event, AuditContext context) {
        this.logAuth(event, context, null, null);
    }

    /**
     * Records an authentication event. {@code email} is stored only as a keyed hash.
     */
    public void logAuth(AuthEvent event, AuditContext context, String email, String reason) {
        this.record(() -> {
            ActorType actor = context != null && context.hasUser() ? ActorType.USER : ActorType.ANONYMOUS;
            AuditMetadata.AuthMetadata metadata = new AuditMetadata.AuthMetadata(event, this.hashEmail(email), reason);
            return this.entry(event.getAction(), actor, "User", context)
                    .withResourceId(context != null ? context.userId() : null)
                    .withMetadata(this.toJson(metadata))
                    .withOutcome(event.isSuccess(), event.isSuccess() ? null : reason);
        });
    }

    public void logExport(String resourceType, List<String> resourceIds, String format, AuditContext context) {
        this.record(() -> {
            List<String> ids = resourceIds != null ? resourceIds : List.of();
            int limit = this.settings.exportIdLimit();
            List<String> stored = ids.size() > limit ? List.copyOf(ids.subList(0, limit)) : List.copyOf(ids);
            AuditMetadata.ExportMetadata metadata = new AuditMetadata.ExportMetadata(format, ids.size(), stored, ids.size() > limit);
            return this.entry(AuditAction.EXPORT, actorFor(context), resourceType, context)
                    .withMetadata(this.toJson(metadata));
        });
    }

    public void logSystem(AuditAction action, String resourceType, AuditMetadata metadata) {
        this.logSystem(action, resourceType, null, metadata);
    }

    public void logSystem(AuditAction action, String resourceType, String resourceId, AuditMetadata metadata) {
        this.record(() -> this.entry(action, ActorType.SYSTEM, resourceType, AuditContext.system())
                .withResourceId(resourceId)
                .withMetadata(this.toJson(metadata)));
    }

    public AuditLogPage queryLogs(AuditLogQuery filters) {
        Query query = new Query();
        if (filters.userId() != null) {
            query.addCriteria(Criteria.where("userId").is(filters.userId()));
        }
        if (filters.resourceType() != null) {
            query.addCriteria(Criteria.where("resourceType").is(filters.resourceType()));
        }
        if (filters.resourceId() != null) {
            query.addCriteria(Criteria.where("resourceId").is(filters.resourceId()));
        }
        if (filters.action() != null) {
            query.addCriteria(Criteria.where("action").is(filters.action()));
        }
        if (filters.startDate() != null || filters.endDate() != null) {
            Criteria createdAt = Criteria.where("createdAt");
            if (filters.startDate() != null) {
                createdAt = createdAt.gte(filters.startDate());
            }
            if (filters.endDate() != null) {
                createdAt = createdAt.lte(filters.endDate());
            }
            query.addCriteria(createdAt);
        }
        long total = this.mongoTemplate.count(query, AuditLog.class);
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .skip(filters.effectiveOffset())
                .limit(filters.effectiveLimit());
        List<AuditLog> logs = this.mongoTemplate.find(query, AuditLog.class);
        return new AuditLogPage(logs, total);
    }

    public AuditStats getStats(Instant since) {
        Criteria window = Criteria.where("createdAt").gte(since);
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(window),
                Aggregation.group("action").count().as("count"));
        Map<String, Long> byAction = new LinkedHashMap<>();
        long total = 0;
        for (Document row : this.mongoTemplate.aggregate(aggregation, AuditLog.class, Document.class).getMappedResults()) {
            long count = ((Number) row.get("count")).longValue();
            byAction.put(String.valueOf(row.get("_id")), count);
            total += count;
        }
        long failures = this.mongoTemplate.count(new Query(Criteria.where("createdAt").gte(since).and("success").is(false)), AuditLog.class);
        return new AuditStats(since, total, failures, byAction);
    }

    public Optional<AuditLog> findById(String id) {
        return this.auditLogRepository.findById(id);
    }

    /**
     * Privileged decryption of a record's value snapshots. The decryption itself
     * is audited as {@code PHI_DECRYPT}; integrity failures propagate.
     */
    public AuditSnapshot decryptSnapshot(AuditLog entry, AuditContext requester) {
        this.record(() -> this.entry(AuditAction.PHI_DECRYPT, actorFor(requester), "AuditLog", requester)
                .withResourceId(entry.getId())
                .withMetadata(this.toJson(new AuditMetadata.AccessMetadata("audit_review",
                        Map.of("sourceAction", String.valueOf(entry.getAction()))))));
        String salt = this.requireSalt();
        return new AuditSnapshot(entry.getId(),
                this.decryptValue(entry.getPreviousValueEncrypted(), salt),
                this.decryptValue(entry.getNewValueEncrypted(), salt));
    }

    public Optional<AuditMetadata> readMetadata(AuditLog entry) {
        if (entry.getMetadata() == null || entry.getMetadata().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(this.objectMapper.readValue(entry.getMetadata(), AuditMetadata.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit metadata on record {}", entry.getId());
            return Optional.empty();
        }
    }

    /**
     * Deletes records past the retention window and audits the sweep itself.
     */
    public long cleanupOldLogs() {
        Instant cutoff = this.clock.instant().minus(Duration.ofDays(this.settings.retentionDays()));
        long deleted = this.auditLogRepository.deleteByCreatedAtBefore(cutoff);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deletedCount", deleted);
        details.put("cutoffDate", cutoff.toString());
        this.logSystem(AuditAction.DELETE, "AuditLog", new AuditMetadata.SystemMetadata("retention_cleanup", details));
        log.info("Audit retention cleanup removed {} records older than {}", deleted, cutoff);
        return deleted;
    }

    private AuditLog entry(AuditAction action, ActorType actor, String resourceType, AuditContext context) {
        AuditLog entry = AuditLog.create(action, actor, resourceType).at(this.clock.instant());
        if (context != null) {
            entry.withActor(context.userId(), context.ipAddress(), context.userAgent());
            entry.setSessionId(context.sessionId());
            entry.setCorrelationId(context.correlationId());
        }
        return entry;
    }

    private void record(AuditEntryBuilder builder) {
        AuditLog entry = null;
        try {
            entry = builder.build();
            this.write(entry);
        } catch (RuntimeException e) {
            log.error("CRITICAL: Failed to create audit log entry: {} {} - {}",
                    entry != null ? entry.getAction() : "?", entry != null ? entry.getResourceType() : "?", e.getMessage());
        }
    }

    private void write(AuditLog entry) {
        try {
            this.auditLogRepository.save(entry);
            log.debug("Audit event logged: {} - {} - {}", entry.getAction(), entry.getActorType(), entry.getResourceType());
        } catch (DataAccessException e) {
            throw new AuditWriteException("Audit store rejected " + entry.getAction() + " record", e);
        }
    }

    private String encryptSnapshot(Object value) {
        if (value == null) {
            return null;
        }
        try {
            String json = value instanceof String text ? text : this.objectMapper.writeValueAsString(value);
            return this.encryptionService.encrypt(json, this.requireSalt());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to encrypt audit value: {}", e.getClass().getSimpleName());
            return ENCRYPTION_FAILED;
        }
    }

    private String decryptValue(String encrypted, String salt) {
        if (encrypted == null || ENCRYPTION_FAILED.equals(encrypted)) {
            return encrypted;
        }
        return this.encryptionService.decrypt(encrypted, salt);
    }

    private String toJson(AuditMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return this.objectMapper.writerFor(AuditMetadata.class).writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new AuditWriteException("Audit metadata could not be serialised", e);
        }
    }

    private String hashEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return this.encryptionService.hashForSearch(email, this.requireSalt());
    }

    private List<String> changedFields(Object previousValue, Object newValue) {
        if (previousValue == null || newValue == null) {
            return List.of();
        }
        JsonNode before = this.objectMapper.valueToTree(previousValue);
        JsonNode after = this.objectMapper.valueToTree(newValue);
        if (!before.isObject() || !after.isObject()) {
            return List.of();
        }
        TreeSet<String> names = new TreeSet<>();
        before.fieldNames().forEachRemaining(names::add);
        after.fieldNames().forEachRemaining(names::add);
        List<String> changed = new ArrayList<>();
        Iterator<String> it = names.iterator();
        while (it.hasNext()) {
            String name = it.next();
            if (!Objects.equals(before.get(name), after.get(name))) {
                changed.add(name);
            }
        }
        return changed;
    }

    private String requireSalt() {
        String salt = this.auditSalt;
        if (salt == null) {
            this.initialize();
            salt = this.auditSalt;
        }
        return salt;
    }

    private static ActorType actorFor(AuditContext context) {
        return context != null && context.hasUser() ? ActorType.USER : ActorType.SYSTEM;
    }

    @FunctionalInterface
    private interface AuditEntryBuilder {
        AuditLog build();
    }
}
