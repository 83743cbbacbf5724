package com.sams.authservice.config;

import com.sams.authservice.model.Role;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import com.sams.authservice.service.PasswordHasher;
import com.sams.authservice.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final BootstrapAdminProperties bootstrapAdmin;
    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    @Override
    public void run(String... args) {
        if (!bootstrapAdmin.isConfigured()) {
            return;
        }
        String email = EmailAddresses.normalize(bootstrapAdmin.getEmail());
        if (userRepository.existsByEmail(email) || userRepository.existsByUsername(bootstrapAdmin.getUsername())) {
            log.info("Bootstrap admin {} already present", email);
            return;
        }
        log.info("Seeding bootstrap admin: {}", email);
        userRepository.save(User.builder()
                .username(bootstrapAdmin.getUsername())
                .email(email)
                .passwordHash(passwordHasher.hash(bootstrapAdmin.getPassword()))
                .role(Role.ADMIN)
                .active(true)
                .build());
    }
}
