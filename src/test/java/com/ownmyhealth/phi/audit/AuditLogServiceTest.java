package com.ownmyhealth.phi.audit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ownmyhealth.phi.config.AuditSettings;
import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.crypto.MasterKey;
import com.ownmyhealth.phi.filter.CorrelationIdFilter;
import com.ownmyhealth.phi.model.ActorType;
import com.ownmyhealth.phi.model.AuditAction;
import com.ownmyhealth.phi.model.AuditLog;
import com.ownmyhealth.phi.model.SystemConfig;
import com.ownmyhealth.phi.repository.AuditLogRepository;
import com.ownmyhealth.phi.repository.SystemConfigRepository;
import com.ownmyhealth.phi.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

class AuditLogServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final AuditContext USER_CONTEXT = new AuditContext("user-1", "203.0.113.7", "JUnit", "session-1", null);

    private AuditLogRepository auditLogRepository;
    private SystemConfigRepository systemConfigRepository;
    private EncryptionService encryptionService;
    private AuditLogService service;

    record Vitals(String systolic, String diastolic, String note) {
    }

    @BeforeEach
    void setUp() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        this.encryptionService = new EncryptionService(MasterKey.fromHex(HexFormat.of().formatHex(key), false), 1000);
        this.auditLogRepository = mock(AuditLogRepository.class);
        this.systemConfigRepository = mock(SystemConfigRepository.class);
        ClientIpResolver ipResolver = new ClientIpResolver();
        ReflectionTestUtils.setField(ipResolver, "trustedProxyList", "");
        ipResolver.init();
        this.service = new AuditLogService(this.auditLogRepository, this.systemConfigRepository, mock(MongoTemplate.class),
                this.encryptionService, new ObjectMapper(), ipResolver, AuditSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private List<AuditLog> savedEntries() {
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(this.auditLogRepository, atLeastOnce()).save(captor.capture());
        return new ArrayList<>(captor.getAllValues());
    }

    private AuditLog lastSaved() {
        List<AuditLog> entries = this.savedEntries();
        return entries.get(entries.size() - 1);
    }

    @Test
    void firstStartGeneratesSaltAndStoresItEncrypted() {
        when(this.systemConfigRepository.findByKey(AuditLogService.AUDIT_SALT_KEY)).thenReturn(Optional.empty());

        this.service.initialize();

        ArgumentCaptor<SystemConfig> captor = ArgumentCaptor.forClass(SystemConfig.class);
        verify(this.systemConfigRepository).save(captor.capture());
        SystemConfig stored = captor.getValue();
        assertTrue(stored.isEncrypted());
        assertTrue(this.encryptionService.decryptWithMasterKey(stored.getValue()).matches("^[0-9a-f]{64}$"));
        assertTrue(this.service.isInitialized());
    }

    @Test
    void legacyPlaintextSaltIsUpgradedInPlace() {
        String salt = this.encryptionService.generateUserSalt();
        SystemConfig legacy = new SystemConfig(AuditLogService.AUDIT_SALT_KEY, salt, "legacy", false, NOW.minus(Duration.ofDays(90)));
        when(this.systemConfigRepository.findByKey(AuditLogService.AUDIT_SALT_KEY)).thenReturn(Optional.of(legacy));

        this.service.initialize();

        assertTrue(legacy.isEncrypted());
        assertEquals(salt, this.encryptionService.decryptWithMasterKey(legacy.getValue()));
        verify(this.systemConfigRepository).save(legacy);
    }

    @Test
    void invalidOrUndecryptableSaltStopsStartup() {
        when(this.systemConfigRepository.findByKey(AuditLogService.AUDIT_SALT_KEY))
                .thenReturn(Optional.of(new SystemConfig(AuditLogService.AUDIT_SALT_KEY, "not-a-salt", null, false, NOW)));
        assertThrows(IllegalStateException.class, () -> this.service.initialize());

        when(this.systemConfigRepository.findByKey(AuditLogService.AUDIT_SALT_KEY))
                .thenReturn(Optional.of(new SystemConfig(AuditLogService.AUDIT_SALT_KEY, "AAAA:BBBB:CCCC", null, true, NOW)));
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> this.service.initialize());
        assertTrue(ex.getMessage().contains("master key"));
        assertFalse(this.service.isInitialized());
    }

    @Test
    void updateKeepsValuesEncryptedAndRecordsOnlyFieldNames() {
        Vitals before = new Vitals("120", "80", "resting");
        Vitals after = new Vitals("135", "80", "after stairs");

        this.service.logUpdate("Vitals", "v-1", before, after, USER_CONTEXT);

        AuditLog entry = this.lastSaved();
        assertEquals(AuditAction.UPDATE, entry.getAction());
        assertEquals(ActorType.USER, entry.getActorType());
        assertEquals("user-1", entry.getUserId());
        assertEquals("session-1", entry.getSessionId());
        assertEquals(NOW, entry.getCreatedAt());
        assertFalse(entry.getNewValueEncrypted().contains("stairs"));
        assertFalse(entry.getMetadata().contains("stairs"));
        assertFalse(entry.getMetadata().contains("135"));

        AuditMetadata metadata = this.service.readMetadata(entry).orElseThrow();
        assertEquals(new AuditMetadata.ChangeMetadata(List.of("note", "systolic")), metadata);

        entry.setId("log-1");
        AuditSnapshot snapshot = this.service.decryptSnapshot(entry, AuditContext.ofUser("admin-1"));
        assertTrue(snapshot.previousValue().contains("\"note\":\"resting\""));
        assertTrue(snapshot.newValue().contains("\"systolic\":\"135\""));

        AuditLog decryptAudit = this.lastSaved();
        assertEquals(AuditAction.PHI_DECRYPT, decryptAudit.getAction());
        assertEquals("log-1", decryptAudit.getResourceId());
        assertEquals("admin-1", decryptAudit.getUserId());
    }

    @Test
    void storeFailureIsSwallowed() {
        when(this.auditLogRepository.save(any(AuditLog.class))).thenThrow(new DataAccessResourceFailureException("down"));

        assertDoesNotThrow(() -> this.service.logAccess("UserProfile", "user-1", USER_CONTEXT,
                new AuditMetadata.AccessMetadata("profile_view", Map.of())));
        assertDoesNotThrow(() -> this.service.logAuth(AuthEvent.LOGIN, USER_CONTEXT));
    }

    @Test
    void failedLoginIsAnonymousAndHashesTheEmail() {
        this.service.logAuth(AuthEvent.LOGIN_FAILED, AuditContext.system(), "patient@example.com", "INVALID_CREDENTIALS");

        AuditLog entry = this.lastSaved();
        assertEquals(AuditAction.LOGIN, entry.getAction());
        assertEquals(ActorType.ANONYMOUS, entry.getActorType());
        assertFalse(entry.isSuccess());
        assertEquals("INVALID_CREDENTIALS", entry.getErrorMessage());
        assertFalse(entry.getMetadata().contains("patient@example.com"));
        AuditMetadata.AuthMetadata metadata = (AuditMetadata.AuthMetadata) this.service.readMetadata(entry).orElseThrow();
        assertEquals(AuthEvent.LOGIN_FAILED, metadata.event());
        assertEquals(64, metadata.emailHash().length());
    }

    @Test
    void failedTokenRedemptionsAreStoredAsFailures() {
        this.service.logAuth(AuthEvent.EMAIL_VERIFICATION_FAILED, AuditContext.system(), null, "Invalid verification token");
        AuditLog verification = this.lastSaved();
        assertEquals(AuditAction.UPDATE, verification.getAction());
        assertFalse(verification.isSuccess());
        assertEquals("Invalid verification token", verification.getErrorMessage());

        this.service.logAuth(AuthEvent.PASSWORD_RESET_FAILED, AuditContext.system(), null, "Invalid or expired reset token");
        AuditLog reset = this.lastSaved();
        assertFalse(reset.isSuccess());
        assertEquals("Invalid or expired reset token", reset.getErrorMessage());
    }

    @Test
    void exportCapsStoredIds() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            ids.add("rec-" + i);
        }

        this.service.logExport("Biomarker", ids, "csv", USER_CONTEXT);

        AuditMetadata.ExportMetadata metadata = (AuditMetadata.ExportMetadata) this.service.readMetadata(this.lastSaved()).orElseThrow();
        assertEquals(250, metadata.totalCount());
        assertEquals(100, metadata.resourceIds().size());
        assertTrue(metadata.truncated());
    }

    @Test
    void unserialisableSnapshotStoresFailureMarker() {
        Object unserialisable = new Object() {
            public Object getSelf() {
                return this;
            }
        };

        this.service.logCreate("Thing", "t-1", unserialisable, USER_CONTEXT);

        assertEquals(AuditLogService.ENCRYPTION_FAILED, this.lastSaved().getNewValueEncrypted());
    }

    @Test
    void requestContextTruncatesUserAgent() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("198.51.100.4");
        request.addHeader("User-Agent", "x".repeat(800));

        AuditContext context = this.service.extractContext(request);

        assertEquals("198.51.100.4", context.ipAddress());
        assertEquals(500, context.userAgent().length());
        assertNull(context.userId());
    }

    @Test
    void requestCorrelationIdIsStampedOnTheEntry() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.HEADER_NAME, "req-77");

        new CorrelationIdFilter().doFilter(request, new MockHttpServletResponse(), (req, res) ->
                this.service.logAccess("UserProfile", "user-1", this.service.extractContext((HttpServletRequest) req).withUser("user-1"),
                        new AuditMetadata.AccessMetadata("profile_view", Map.of())));

        AuditLog entry = this.lastSaved();
        assertEquals("req-77", entry.getCorrelationId());
        assertEquals("user-1", entry.getUserId());
        assertNull(this.service.extractContext(new MockHttpServletRequest()).correlationId());
    }

    @Test
    void retentionCleanupDeletesPastCutoffAndAuditsItself() {
        Instant cutoff = NOW.minus(Duration.ofDays(2555));
        when(this.auditLogRepository.deleteByCreatedAtBefore(cutoff)).thenReturn(42L);

        assertEquals(42L, this.service.cleanupOldLogs());

        AuditLog entry = this.lastSaved();
        assertEquals(AuditAction.DELETE, entry.getAction());
        assertEquals(ActorType.SYSTEM, entry.getActorType());
        assertTrue(entry.getMetadata().contains("\"deletedCount\":42"));
    }
}
