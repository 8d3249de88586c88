package com.ownmyhealth.phi.exception;

public class EmailNotVerifiedException extends PhiCoreException {
    public EmailNotVerifiedException(String message) {
        super(message);
    }
}
