package com.ownmyhealth.phi.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Process-wide master secret. Loaded once at startup, validated, then held
 * read-only for the lifetime of the process. Never persisted or logged.
 *
 * The key is supplied as hexadecimal (at least 64 characters, 256 bits).
 * Known placeholder keys are rejected when running in production.
 */
public final class MasterKey {
    public static final int MIN_HEX_LENGTH = 64;
    private static final int AES_KEY_BYTES = 32;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");
    private static final Set<String> PLACEHOLDER_KEYS = Set.of(
            "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef",
            "ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
            "0000000000000000000000000000000000000000000000000000000000000000");

    private final byte[] aesKey;
    private final String kdfSecret;
    private final int bits;

    private MasterKey(String normalizedHex) {
        byte[] raw = HexFormat.of().parseHex(normalizedHex);
        this.bits = raw.length * 8;
        this.aesKey = raw.length == AES_KEY_BYTES ? raw : condense(raw);
        this.kdfSecret = normalizedHex;
    }

    public static MasterKey fromHex(String hex, boolean production) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalStateException("PHI master key (app.crypto.master-key) is not set");
        }
        String trimmed = hex.trim();
        if (trimmed.length() < MIN_HEX_LENGTH) {
            throw new IllegalStateException("PHI master key must be at least " + MIN_HEX_LENGTH
                    + " hex characters (256 bits). Current length: " + trimmed.length());
        }
        if (!HEX.matcher(trimmed).matches()) {
            throw new IllegalStateException("PHI master key must contain only hexadecimal characters (0-9, a-f, A-F)");
        }
        if (trimmed.length() % 2 != 0) {
            throw new IllegalStateException("PHI master key must have an even number of hex characters");
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        if (production && PLACEHOLDER_KEYS.contains(normalized)) {
            throw new IllegalStateException("PHI master key appears to be a placeholder. Generate one with: openssl rand -hex 32");
        }
        return new MasterKey(normalized);
    }

    public static boolean isPlaceholder(String hex) {
        return hex != null && PLACEHOLDER_KEYS.contains(hex.trim().toLowerCase(Locale.ROOT));
    }

    byte[] aesKey() {
        return this.aesKey.clone();
    }

    char[] kdfPassword() {
        return this.kdfSecret.toCharArray();
    }

    public int bits() {
        return this.bits;
    }

    // Keys longer than 256 bits are condensed so the master-key cipher stays AES-256.
    private static byte[] condense(byte[] raw) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(raw);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return "MasterKey[" + this.bits + " bits]";
    }
}
