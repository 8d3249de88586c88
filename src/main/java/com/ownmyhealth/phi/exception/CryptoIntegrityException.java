package com.ownmyhealth.phi.exception;

/**
 * Raised when the GCM authentication tag does not verify: the value was
 * tampered with or is being opened with the wrong salt.
 */
public class CryptoIntegrityException extends CryptoException {
    public CryptoIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
