package com.ownmyhealth.phi.exception;

/**
 * Raised when an encoded value or salt cannot be parsed.
 */
public class CryptoFormatException extends CryptoException {
    public CryptoFormatException(String message) {
        super(message);
    }

    public CryptoFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
