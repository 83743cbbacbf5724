package com.sams.authservice.service;

import com.sams.authservice.config.JwtUtil;
import com.sams.authservice.dto.LoginRequest;
import com.sams.authservice.dto.RegisterRequest;
import com.sams.authservice.dto.TokenResponse;
import com.sams.authservice.dto.UserResponse;
import com.sams.authservice.exception.UserAlreadyExistsException;
import com.sams.authservice.model.Role;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import com.sams.authservice.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicyService passwordPolicyService;
    private final Authenticator authenticator;
    private final JwtUtil jwtUtil;

    public UserResponse register(RegisterRequest request) {
        String email = EmailAddresses.normalize(request.getEmail());
        String username = request.getUsername().trim();

        if (userRepository.existsByUsername(username)) {
            throw UserAlreadyExistsException.usernameTaken();
        }
        if (userRepository.existsByEmail(email)) {
            throw UserAlreadyExistsException.emailTaken();
        }
        passwordPolicyService.validatePassword(request.getPassword());

        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHasher.hash(request.getPassword()))
                .role(Role.USER)
                .active(true)
                .build();
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same email or username
            throw new UserAlreadyExistsException(null, "User already registered");
        }
        log.info("Registered user {} (id={})", user.getUsername(), user.getId());
        return UserResponse.from(user);
    }

    public TokenResponse login(LoginRequest request) {
        User user = authenticator.authenticate(request.getEmail(), request.getPassword());
        String token = jwtUtil.generateToken(user);
        log.info("Login successful: {}", user.getEmail());
        return TokenResponse.builder()
                .accessToken(token)
                .tokenType(TokenResponse.BEARER)
                .build();
    }
}
