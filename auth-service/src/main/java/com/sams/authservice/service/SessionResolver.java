package com.sams.authservice.service;

import com.sams.authservice.config.JwtUtil;
import com.sams.authservice.exception.AccountInactiveException;
import com.sams.authservice.exception.UnauthenticatedException;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import com.sams.authservice.security.Session;
import com.sams.authservice.security.TokenClaims;
import com.sams.authservice.security.TokenDecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Turns a bearer token into the live user it points at. The token only names
 * the user: role and active status always come from the store, so a user
 * deactivated after login is locked out before the token expires.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SessionResolver {

    private final JwtUtil jwtUtil;
    private final UserRepository userRepository;
    private final Clock clock;

    public Session resolve(String token) {
        TokenClaims claims;
        try {
            claims = jwtUtil.decode(token);
        } catch (TokenDecodeException e) {
            log.debug("Rejected bearer token ({}): {}", e.getReason(), e.getMessage());
            throw new UnauthenticatedException(e);
        }

        User user = userRepository.findByEmail(claims.getSubject())
                .orElseThrow(() -> {
                    log.debug("Token subject {} no longer exists", claims.getSubject());
                    return new UnauthenticatedException();
                });
        if (!user.getId().equals(claims.getUserId())) {
            log.debug("Token user id {} does not match stored user {}", claims.getUserId(), user.getId());
            throw new UnauthenticatedException();
        }
        if (!user.isActive()) {
            throw new AccountInactiveException();
        }
        return new Session(user, clock.instant());
    }
}
