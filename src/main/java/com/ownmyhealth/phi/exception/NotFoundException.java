package com.ownmyhealth.phi.exception;

public class NotFoundException extends PhiCoreException {
    public NotFoundException(String message) {
        super(message);
    }
}
