package com.ownmyhealth.phi.crypto;

import com.ownmyhealth.phi.exception.CryptoFormatException;
import com.ownmyhealth.phi.exception.CryptoIntegrityException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application-layer encryption for Protected Health Information.
 *
 * SECURITY:
 * - AES-256-GCM authenticated encryption, 96-bit random IV per call, 128-bit tag
 * - Per-user keys derived with PBKDF2-HMAC-SHA512 from the master key and the user's salt
 * - Master-key encryption reserved for per-user salts and the audit salt
 * - HMAC-SHA256 search hashes over normalised values
 *
 * Decryption is fail-closed: a tag that does not verify raises
 * {@link CryptoIntegrityException}, a malformed value raises {@link CryptoFormatException}.
 */
public class EncryptionService {
    private static final Logger log = LoggerFactory.getLogger(EncryptionService.class);

    public static final int DEFAULT_KDF_ITERATIONS = 100_000;
    private static final String AES_GCM_ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA512";
    private static final String HMAC_ALGO = "HmacSHA256";
    private static final int GCM_IV_LENGTH = EncryptedValue.IV_LENGTH;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int DERIVED_KEY_BITS = 256;
    private static final int SALT_LENGTH = 32;

    private final MasterKey masterKey;
    private final int kdfIterations;
    private final SecureRandom secureRandom = new SecureRandom();

    public EncryptionService(MasterKey masterKey) {
        this(masterKey, DEFAULT_KDF_ITERATIONS);
    }

    public EncryptionService(MasterKey masterKey, int kdfIterations) {
        if (masterKey == null) {
            throw new IllegalStateException("Encryption service requires a master key");
        }
        if (kdfIterations < 1) {
            throw new IllegalStateException("KDF iterations must be positive");
        }
        this.masterKey = masterKey;
        this.kdfIterations = kdfIterations;
        log.info("PHI encryption initialized ({}, {} KDF iterations)", masterKey, kdfIterations);
    }

    /**
     * Encrypt a value under the key derived for {@code userSalt}.
     * Empty input maps to empty output so optional fields stay optional.
     */
    public String encrypt(String plaintext, String userSalt) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        return seal(deriveUserKey(userSalt), plaintext).encode();
    }

    public String decrypt(String encoded, String userSalt) {
        if (encoded == null || encoded.isEmpty()) {
            return "";
        }
        EncryptedValue value = EncryptedValue.parse(encoded);
        return open(deriveUserKey(userSalt), value);
    }

    public String encryptWithMasterKey(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        return seal(this.masterKey.aesKey(), plaintext).encode();
    }

    public String decryptWithMasterKey(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return "";
        }
        return open(this.masterKey.aesKey(), EncryptedValue.parse(encoded));
    }

    public String generateUserSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        this.secureRandom.nextBytes(salt);
        return HexFormat.of().formatHex(salt);
    }

    /**
     * Deterministic keyed digest for equality lookups. Input is trimmed and
     * lower-cased first, so "Test@Email.com" and "test@email.com " collide.
     */
    public String hashForSearch(String value, String salt) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot hash a null value");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(parseSalt(salt), HMAC_ALGO));
            byte[] digest = mac.doFinal(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute search hash", e);
        }
    }

    /**
     * Returns a copy of {@code record} with the named string fields encrypted.
     * Null, empty and non-string values pass through unchanged.
     */
    public Map<String, Object> encryptFields(Map<String, Object> record, Collection<String> fields, String userSalt) {
        Map<String, Object> encrypted = new LinkedHashMap<>(record);
        byte[] key = null;
        for (String field : fields) {
            if (record.get(field) instanceof String value && !value.isEmpty()) {
                if (key == null) {
                    key = deriveUserKey(userSalt);
                }
                encrypted.put(field, seal(key, value).encode());
            }
        }
        return encrypted;
    }

    /**
     * Inverse of {@link #encryptFields}. Any field that fails to decrypt aborts
     * the whole call; ciphertext is never handed back as if it were plaintext.
     */
    public Map<String, Object> decryptFields(Map<String, Object> record, Collection<String> fields, String userSalt) {
        Map<String, Object> decrypted = new LinkedHashMap<>(record);
        byte[] key = null;
        for (String field : fields) {
            if (record.get(field) instanceof String value && !value.isEmpty()) {
                if (key == null) {
                    key = deriveUserKey(userSalt);
                }
                EncryptedValue parsed = EncryptedValue.parse(value);
                decrypted.put(field, open(key, parsed));
            }
        }
        return decrypted;
    }

    /**
     * Key rotation primitive: opens under {@code oldSalt}, seals under {@code newSalt}.
     */
    public String reEncrypt(String encoded, String oldSalt, String newSalt) {
        if (encoded == null || encoded.isEmpty()) {
            return "";
        }
        String plaintext = open(deriveUserKey(oldSalt), EncryptedValue.parse(encoded));
        return seal(deriveUserKey(newSalt), plaintext).encode();
    }

    private byte[] deriveUserKey(String userSalt) {
        byte[] salt = parseSalt(userSalt);
        char[] password = this.masterKey.kdfPassword();
        PBEKeySpec spec = new PBEKeySpec(password, salt, this.kdfIterations, DERIVED_KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("User key derivation failed", e);
        } finally {
            spec.clearPassword();
            java.util.Arrays.fill(password, '\0');
        }
    }

    private EncryptedValue seal(byte[] key, String plaintext) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        this.secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] output = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return EncryptedValue.fromCipherOutput(iv, output);
        } catch (GeneralSecurityException e) {
            log.error("AES-256-GCM encryption failed: {}", e.getMessage());
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    private String open(byte[] key, EncryptedValue value) {
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, value.iv()));
            byte[] plaintext = cipher.doFinal(value.ciphertextWithTag());
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            log.warn("AES-256-GCM tag verification failed (tampered value or wrong key)");
            throw new CryptoIntegrityException("Decryption failed - data integrity check did not pass", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoFormatException("Decryption failed - unusable cipher parameters", e);
        }
    }

    private static byte[] parseSalt(String salt) {
        if (salt == null || salt.isEmpty()) {
            throw new CryptoFormatException("Salt is empty");
        }
        try {
            return HexFormat.of().parseHex(salt);
        } catch (IllegalArgumentException e) {
            throw new CryptoFormatException("Salt must be hexadecimal", e);
        }
    }
}
