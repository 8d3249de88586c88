package com.ownmyhealth.phi.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class PasswordService {
    public static final int MIN_LENGTH = 8;
    // Valid 60-char bcrypt hash (cost 12) used only to burn the same CPU time as a real check.
    static final String DUMMY_HASH = "$2a$12$LQv3c1yqBWVHxkd0LHAkCOYz6TtxMQJqhN8/X4.VCoBWZPW.pG4aG";
    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    private final PasswordEncoder passwordEncoder;

    public PasswordService(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hashPassword(String password) {
        return this.passwordEncoder.encode(password);
    }

    public boolean verifyPassword(String password, String hash) {
        if (password == null || hash == null || hash.isEmpty()) {
            return false;
        }
        return this.passwordEncoder.matches(password, hash);
    }

    /**
     * Compare against a fixed hash so a missing account costs as much as a wrong password.
     */
    public void simulateVerification(String password) {
        this.passwordEncoder.matches(password != null ? password : "", DUMMY_HASH);
    }

    /**
     * Reports every rule the candidate breaks, not just the first.
     */
    public PasswordValidationResult validatePasswordStrength(String password) {
        String candidate = password != null ? password : "";
        List<String> errors = new ArrayList<>();
        if (candidate.length() < MIN_LENGTH) {
            errors.add("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (!UPPER.matcher(candidate).find()) {
            errors.add("Password must contain at least one uppercase letter");
        }
        if (!LOWER.matcher(candidate).find()) {
            errors.add("Password must contain at least one lowercase letter");
        }
        if (!DIGIT.matcher(candidate).find()) {
            errors.add("Password must contain at least one number");
        }
        if (!SPECIAL.matcher(candidate).find()) {
            errors.add("Password must contain at least one special character");
        }
        return new PasswordValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
