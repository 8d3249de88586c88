package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.model.User;

/**
 * Outcome of an account maintenance flow (verification, password reset).
 * {@code token} is the one-time token to deliver out of band, when one was issued.
 */
public record AccountResult(boolean success, String error, String token, User user) {

    public static AccountResult ok() {
        return new AccountResult(true, null, null, null);
    }

    public static AccountResult withToken(String token) {
        return new AccountResult(true, null, token, null);
    }

    public static AccountResult forUser(User user) {
        return new AccountResult(true, null, null, user);
    }

    public static AccountResult failure(String error) {
        return new AccountResult(false, error, null, null);
    }
}
