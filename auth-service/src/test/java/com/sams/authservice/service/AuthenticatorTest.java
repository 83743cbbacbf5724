package com.sams.authservice.service;

import com.sams.authservice.exception.AccountInactiveException;
import com.sams.authservice.exception.InvalidCredentialsException;
import com.sams.authservice.model.Role;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Authenticator Tests")
class AuthenticatorTest {

    private static final String PASSWORD = "Secur3!pass";

    @Mock
    private UserRepository userRepository;

    private PasswordHasher passwordHasher;
    private Authenticator authenticator;

    @BeforeEach
    void setUp() {
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
        authenticator = new Authenticator(userRepository, passwordHasher);
    }

    private User storedUser(boolean active) {
        return User.builder()
                .id(1L)
                .username("alice")
                .email("a@x.com")
                .passwordHash(passwordHasher.hash(PASSWORD))
                .role(Role.USER)
                .active(active)
                .build();
    }

    @Test
    @DisplayName("Correct credentials of an active user return the user")
    void shouldAuthenticate() {
        User user = storedUser(true);
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(user));

        assertThat(authenticator.authenticate("a@x.com", PASSWORD)).isSameAs(user);
    }

    @Test
    @DisplayName("Email is normalized before lookup")
    void shouldNormalizeEmail() {
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(storedUser(true)));

        assertThat(authenticator.authenticate("  A@X.com ", PASSWORD).getId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Unknown email and wrong password fail with the same error")
    void shouldNotRevealWhichPartWasWrong() {
        when(userRepository.findByEmail(anyString())).thenReturn(Optional.empty());
        Throwable unknownEmail = catchThrowable(() -> authenticator.authenticate("nobody@x.com", PASSWORD));

        reset(userRepository);
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(storedUser(true)));
        Throwable wrongPassword = catchThrowable(() -> authenticator.authenticate("a@x.com", "Wr0ng!pass"));

        assertThat(unknownEmail).isInstanceOf(InvalidCredentialsException.class);
        assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class)
                .hasMessage(unknownEmail.getMessage());
    }

    @Test
    @DisplayName("Inactive account with the right password is reported as inactive")
    void shouldRejectInactiveAccount() {
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(storedUser(false)));

        assertThatThrownBy(() -> authenticator.authenticate("a@x.com", PASSWORD))
                .isInstanceOf(AccountInactiveException.class);
    }

    @Test
    @DisplayName("Inactive account with a wrong password is only reported as invalid credentials")
    void shouldNotRevealInactiveStatusToWrongPassword() {
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(storedUser(false)));

        assertThatThrownBy(() -> authenticator.authenticate("a@x.com", "Wr0ng!pass"))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    @DisplayName("Corrupted stored hash fails as invalid credentials")
    void shouldRejectCorruptedHash() {
        User user = storedUser(true);
        user.setPasswordHash("garbage");
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authenticator.authenticate("a@x.com", PASSWORD))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    @DisplayName("Authentication never writes to the store")
    void shouldOnlyRead() {
        when(userRepository.findByEmail("a@x.com")).thenReturn(Optional.of(storedUser(true)));

        authenticator.authenticate("a@x.com", PASSWORD);

        verify(userRepository).findByEmail("a@x.com");
        verifyNoMoreInteractions(userRepository);
    }
}
