package com.ownmyhealth.phi.service;

/**
 * Delivers one-time account links (email verification, password reset) to the
 * account holder.
 */
public interface AccountNotifier {

    void sendVerificationLink(String email, String token);

    void sendPasswordResetLink(String email, String token);
}
