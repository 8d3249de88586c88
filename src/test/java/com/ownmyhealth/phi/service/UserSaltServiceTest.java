package com.ownmyhealth.phi.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.mongodb.client.result.UpdateResult;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuditMetadata;
import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.crypto.MasterKey;
import com.ownmyhealth.phi.model.AuditAction;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.repository.UserRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

class UserSaltServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private UserRepository userRepository;
    private MongoTemplate mongoTemplate;
    private AuditLogService auditLogService;
    private EncryptionService encryptionService;
    private UserSaltService service;

    @BeforeEach
    void setUp() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        this.encryptionService = new EncryptionService(MasterKey.fromHex(HexFormat.of().formatHex(key), false), 1000);
        this.userRepository = mock(UserRepository.class);
        this.mongoTemplate = mock(MongoTemplate.class);
        this.auditLogService = mock(AuditLogService.class);
        this.service = new UserSaltService(this.userRepository, this.mongoTemplate, this.encryptionService,
                this.auditLogService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static User user() {
        User user = new User();
        user.setId("user-1");
        user.setEmail("patient@example.com");
        return user;
    }

    @Test
    void firstUseCreatesSaltStoredUnderMasterKey() {
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        User user = user();

        String salt = this.service.getOrCreateSalt(user);

        assertEquals(64, salt.length());
        assertEquals(1, user.getSaltVersion());
        assertNotEquals(salt, user.getEncryptedSalt());
        assertEquals(salt, this.encryptionService.decryptWithMasterKey(user.getEncryptedSalt()));
        assertEquals(salt, this.service.getOrCreateSalt(user));
        verify(this.mongoTemplate, times(1)).updateFirst(any(Query.class), any(Update.class), eq(User.class));
    }

    @Test
    void losingTheCreationRaceReturnsTheWinnersSalt() {
        String winnerSalt = this.encryptionService.generateUserSalt();
        User stored = user();
        stored.setEncryptedSalt(this.encryptionService.encryptWithMasterKey(winnerSalt));
        stored.setSaltVersion(1);
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));
        when(this.userRepository.findById("user-1")).thenReturn(Optional.of(stored));
        User user = user();

        assertEquals(winnerSalt, this.service.getOrCreateSalt(user));
        assertEquals(stored.getEncryptedSalt(), user.getEncryptedSalt());
    }

    @Test
    void rotationReEncryptsProfileAndBumpsVersion() {
        String oldSalt = this.encryptionService.generateUserSalt();
        User user = user();
        user.setEncryptedSalt(this.encryptionService.encryptWithMasterKey(oldSalt));
        user.setSaltVersion(1);
        user.setFirstNameEncrypted(this.encryptionService.encrypt("Ada", oldSalt));
        user.setPhoneEncrypted(this.encryptionService.encrypt("+1-555-0100", oldSalt));
        String oldFirstName = user.getFirstNameEncrypted();
        String oldSealedSalt = user.getEncryptedSalt();
        when(this.userRepository.findById("user-1")).thenReturn(Optional.of(user));
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        User rotated = this.service.rotateSalt("user-1");

        verify(this.mongoTemplate).updateFirst(query.capture(), update.capture(), eq(User.class));
        assertEquals(oldSealedSalt, query.getValue().getQueryObject().get("encryptedSalt"));
        assertTrue(update.getValue().modifies("firstNameEncrypted"));
        assertTrue(update.getValue().modifies("addressEncrypted"));
        assertFalse(update.getValue().modifies("failedLoginAttempts"));
        assertFalse(update.getValue().modifies("lockedUntil"));
        verify(this.userRepository, never()).save(any());

        assertEquals(2, rotated.getSaltVersion());
        assertEquals(NOW, rotated.getSaltRotatedAt());
        String newSalt = this.encryptionService.decryptWithMasterKey(rotated.getEncryptedSalt());
        assertNotEquals(oldSalt, newSalt);
        assertNotEquals(oldFirstName, rotated.getFirstNameEncrypted());
        assertEquals("Ada", this.encryptionService.decrypt(rotated.getFirstNameEncrypted(), newSalt));
        assertEquals("+1-555-0100", this.encryptionService.decrypt(rotated.getPhoneEncrypted(), newSalt));
        assertNull(rotated.getAddressEncrypted());
        verify(this.auditLogService).logSystem(eq(AuditAction.KEY_ROTATION), eq("User"), eq("user-1"),
                any(AuditMetadata.SystemMetadata.class));
    }

    @Test
    void rotatingWithoutSaltJustCreatesOne() {
        User user = user();
        when(this.userRepository.findById("user-1")).thenReturn(Optional.of(user));
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        User rotated = this.service.rotateSalt("user-1");

        assertTrue(this.service.hasSalt(rotated));
        assertEquals(1, rotated.getSaltVersion());
        verifyNoInteractions(this.auditLogService);
    }

    @Test
    void concurrentRotationIsRefused() {
        String oldSalt = this.encryptionService.generateUserSalt();
        User user = user();
        user.setEncryptedSalt(this.encryptionService.encryptWithMasterKey(oldSalt));
        user.setSaltVersion(1);
        when(this.userRepository.findById("user-1")).thenReturn(Optional.of(user));
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThrows(IllegalStateException.class, () -> this.service.rotateSalt("user-1"));
        assertEquals(1, user.getSaltVersion());
        verifyNoInteractions(this.auditLogService);
    }
}
