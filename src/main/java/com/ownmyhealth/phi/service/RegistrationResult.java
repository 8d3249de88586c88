package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.model.User;

public record RegistrationResult(User user, String verificationToken) {
}
