package com.sams.authservice.service;

import com.sams.authservice.exception.AccountInactiveException;
import com.sams.authservice.exception.InvalidCredentialsException;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import com.sams.authservice.util.EmailAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Checks an email/password pair against the credential store. An unknown email
 * and a wrong password fail identically, in message and in cost.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class Authenticator {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final String dummyHash;

    public Authenticator(UserRepository userRepository, PasswordHasher passwordHasher) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.dummyHash = passwordHasher.hash("timing-equalizer");
    }

    public User authenticate(String email, String password) {
        Optional<User> found = userRepository.findByEmail(EmailAddresses.normalize(email));
        if (found.isEmpty()) {
            passwordHasher.verify(password, dummyHash);
            log.warn("Login failed: unknown email {}", email);
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            log.warn("Login failed: wrong password for {}", user.getEmail());
            throw new InvalidCredentialsException();
        }
        if (!user.isActive()) {
            log.warn("Login refused: account {} is inactive", user.getEmail());
            throw new AccountInactiveException();
        }
        return user;
    }
}
