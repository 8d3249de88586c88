package com.ownmyhealth.phi.exception;

public class TokenExpiredException extends PhiCoreException {
    public TokenExpiredException(String message) {
        super(message);
    }
}
