package com.ownmyhealth.phi.exception;

/**
 * Root of the PHI core error taxonomy. All subclasses are unchecked.
 */
public class PhiCoreException extends RuntimeException {
    public PhiCoreException(String message) {
        super(message);
    }

    public PhiCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
