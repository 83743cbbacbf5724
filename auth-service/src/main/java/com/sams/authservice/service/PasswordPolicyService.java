package com.sams.authservice.service;

import com.sams.authservice.config.PasswordProperties;
import com.sams.authservice.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
public class PasswordPolicyService {

    /** BCrypt ignores everything past this many bytes. */
    static final int MAX_PASSWORD_BYTES = 72;

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9]");

    private final PasswordProperties policy;

    public void validatePassword(String password) {
        if (password == null || password.length() < policy.getMinLength()) {
            throw violation("Password must be at least " + policy.getMinLength() + " characters long");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw violation("Password must be at most " + MAX_PASSWORD_BYTES + " bytes long");
        }
        if (policy.isRequireUppercase() && !UPPERCASE.matcher(password).find()) {
            throw violation("Password must contain at least one uppercase letter");
        }
        if (policy.isRequireLowercase() && !LOWERCASE.matcher(password).find()) {
            throw violation("Password must contain at least one lowercase letter");
        }
        if (policy.isRequireDigit() && !DIGIT.matcher(password).find()) {
            throw violation("Password must contain at least one number");
        }
        if (policy.isRequireSpecial() && !SPECIAL.matcher(password).find()) {
            throw violation("Password must contain at least one special character");
        }
    }

    private static ValidationException violation(String message) {
        return new ValidationException("password", message);
    }
}
