package com.ownmyhealth.phi.exception;

/**
 * Wrong token type, bad signature, disallowed algorithm or unparseable token.
 */
public class TokenInvalidException extends PhiCoreException {
    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
