package com.contactsbook.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password hashing over the application's {@link PasswordEncoder} (BCrypt, random salt
 * per call).
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @return {@code false} for a wrong password and for a missing or malformed stored hash
     */
    public boolean verify(String plaintext, String passwordHash) {
        if (plaintext == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, passwordHash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
