package com.ownmyhealth.phi.service;

import java.util.List;

public record PasswordValidationResult(boolean valid, List<String> errors) {
}
