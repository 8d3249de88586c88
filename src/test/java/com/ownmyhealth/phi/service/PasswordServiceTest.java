package com.ownmyhealth.phi.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class PasswordServiceTest {
    private final PasswordService passwordService = new PasswordService(new BCryptPasswordEncoder(4));

    @Test
    void hashVerifiesOnlyTheOriginalPassword() {
        String hash = this.passwordService.hashPassword("Str0ng!Pass");

        assertNotEquals("Str0ng!Pass", hash);
        assertTrue(this.passwordService.verifyPassword("Str0ng!Pass", hash));
        assertFalse(this.passwordService.verifyPassword("str0ng!Pass", hash));
        assertFalse(this.passwordService.verifyPassword(null, hash));
        assertFalse(this.passwordService.verifyPassword("Str0ng!Pass", null));
    }

    @Test
    void reportsEveryViolatedRule() {
        PasswordValidationResult result = this.passwordService.validatePasswordStrength("abc");

        assertFalse(result.valid());
        assertEquals(4, result.errors().size());
        assertTrue(result.errors().contains("Password must be at least 8 characters long"));
        assertTrue(result.errors().contains("Password must contain at least one uppercase letter"));
        assertTrue(result.errors().contains("Password must contain at least one number"));
        assertTrue(result.errors().contains("Password must contain at least one special character"));
    }

    @Test
    void acceptsAPasswordMeetingAllRules() {
        PasswordValidationResult result = this.passwordService.validatePasswordStrength("Health#2024");

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void nullPasswordFailsEveryRule() {
        assertEquals(5, this.passwordService.validatePasswordStrength(null).errors().size());
    }

    @Test
    void simulatedVerificationCompletesWithoutError() {
        assertDoesNotThrow(() -> this.passwordService.simulateVerification("whatever"));
        assertDoesNotThrow(() -> this.passwordService.simulateVerification(null));
    }
}
