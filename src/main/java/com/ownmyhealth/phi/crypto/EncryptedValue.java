package com.ownmyhealth.phi.crypto;

import com.ownmyhealth.phi.exception.CryptoFormatException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Persisted form of an encrypted field: {@code base64(iv):base64(tag):base64(ciphertext)}.
 * Instances own copies of their arrays.
 */
final class EncryptedValue {
    static final char DELIMITER = ':';
    static final int IV_LENGTH = 12;
    static final int TAG_LENGTH = 16;
    private final byte[] iv;
    private final byte[] tag;
    private final byte[] ciphertext;

    private EncryptedValue(byte[] iv, byte[] tag, byte[] ciphertext) {
        this.iv = iv.clone();
        this.tag = tag.clone();
        this.ciphertext = ciphertext.clone();
    }

    static EncryptedValue parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new CryptoFormatException("Encrypted value is empty");
        }
        String[] parts = encoded.split(String.valueOf(DELIMITER), -1);
        if (parts.length != 3) {
            throw new CryptoFormatException("Invalid encrypted data format: expected iv:tag:ciphertext");
        }
        byte[] iv = decode(parts[0], "iv");
        byte[] tag = decode(parts[1], "tag");
        byte[] ciphertext = decode(parts[2], "ciphertext");
        if (iv.length != IV_LENGTH) {
            throw new CryptoFormatException("Invalid IV length: " + iv.length);
        }
        if (tag.length != TAG_LENGTH) {
            throw new CryptoFormatException("Invalid authentication tag length: " + tag.length);
        }
        return new EncryptedValue(iv, tag, ciphertext);
    }

    static EncryptedValue fromCipherOutput(byte[] iv, byte[] cipherOutput) {
        int ciphertextLength = cipherOutput.length - TAG_LENGTH;
        return new EncryptedValue(iv,
                Arrays.copyOfRange(cipherOutput, ciphertextLength, cipherOutput.length),
                Arrays.copyOfRange(cipherOutput, 0, ciphertextLength));
    }

    String encode() {
        Base64.Encoder encoder = Base64.getEncoder();
        return encoder.encodeToString(this.iv) + DELIMITER
                + encoder.encodeToString(this.tag) + DELIMITER
                + encoder.encodeToString(this.ciphertext);
    }

    byte[] iv() {
        return this.iv.clone();
    }

    byte[] ciphertextWithTag() {
        byte[] combined = Arrays.copyOf(this.ciphertext, this.ciphertext.length + this.tag.length);
        System.arraycopy(this.tag, 0, combined, this.ciphertext.length, this.tag.length);
        return combined;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EncryptedValue that)) {
            return false;
        }
        return Arrays.equals(this.iv, that.iv) && Arrays.equals(this.tag, that.tag) && Arrays.equals(this.ciphertext, that.ciphertext);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(this.iv);
        result = 31 * result + Arrays.hashCode(this.tag);
        return 31 * result + Arrays.hashCode(this.ciphertext);
    }

    private static byte[] decode(String part, String name) {
        try {
            return Base64.getDecoder().decode(part);
        } catch (IllegalArgumentException e) {
            throw new CryptoFormatException("Invalid base64 in " + name + " segment", e);
        }
    }
}
