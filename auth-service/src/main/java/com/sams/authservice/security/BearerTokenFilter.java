package com.sams.authservice.security;

import com.sams.authservice.exception.AccountInactiveException;
import com.sams.authservice.exception.UnauthenticatedException;
import com.sams.authservice.service.SessionResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the {@code Authorization: Bearer} header once per request and
 * attaches the outcome to the request. Never rejects a request itself: handlers
 * decide through {@link AccessGuard} whether the outcome is good enough.
 */
@RequiredArgsConstructor
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "bearer ";

    private final SessionResolver sessionResolver;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        RequestSessions.attach(request, resolve(request.getHeader(HttpHeaders.AUTHORIZATION)));
        chain.doFilter(request, response);
    }

    SessionOutcome resolve(String header) {
        if (header == null || header.isBlank()) {
            return SessionOutcome.anonymous();
        }
        if (header.length() <= BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return SessionOutcome.failed(new UnauthenticatedException());
        }
        try {
            return SessionOutcome.resolved(sessionResolver.resolve(header.substring(BEARER_PREFIX.length()).trim()));
        } catch (UnauthenticatedException | AccountInactiveException e) {
            return SessionOutcome.failed(e);
        }
    }
}
