package com.sams.authservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way BCrypt hashing of passwords. The salt and cost factor travel inside
 * the stored hash; comparison is constant-time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @return false for a wrong password and also for a missing or corrupted hash
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be parsed");
            return false;
        }
    }
}
