package com.ownmyhealth.phi.exception;

public abstract class CryptoException extends PhiCoreException {
    protected CryptoException(String message) {
        super(message);
    }

    protected CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
