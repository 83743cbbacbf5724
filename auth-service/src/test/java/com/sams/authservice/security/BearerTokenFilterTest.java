package com.sams.authservice.security;

import com.sams.authservice.exception.AccountInactiveException;
import com.sams.authservice.exception.UnauthenticatedException;
import com.sams.authservice.model.Role;
import com.sams.authservice.model.User;
import com.sams.authservice.service.SessionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BearerTokenFilter Tests")
class BearerTokenFilterTest {

    @Mock
    private SessionResolver sessionResolver;

    private BearerTokenFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenFilter(sessionResolver);
    }

    private SessionOutcome filterWithHeader(String header) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        if (header != null) {
            request.addHeader(HttpHeaders.AUTHORIZATION, header);
        }
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).as("chain continues").isSameAs(request);
        return RequestSessions.current(request);
    }

    @Test
    @DisplayName("No Authorization header yields an anonymous request")
    void shouldMarkAnonymous() throws Exception {
        SessionOutcome outcome = filterWithHeader(null);

        assertThat(outcome.user()).isEmpty();
        assertThatThrownBy(outcome::requireSession).isInstanceOf(UnauthenticatedException.class);
        verifyNoInteractions(sessionResolver);
    }

    @Test
    @DisplayName("Bearer token is resolved once and attached")
    void shouldResolveBearerToken() throws Exception {
        Session session = new Session(User.builder().id(1L).role(Role.USER).build(), Instant.now());
        when(sessionResolver.resolve("abc.def.ghi")).thenReturn(session);

        SessionOutcome outcome = filterWithHeader("Bearer abc.def.ghi");

        assertThat(outcome.requireSession()).isSameAs(session);
        assertThat(outcome.user()).contains(session.getUser());
        verify(sessionResolver, times(1)).resolve(anyString());
    }

    @Test
    @DisplayName("Scheme name is case-insensitive")
    void shouldAcceptLowercaseScheme() throws Exception {
        Session session = new Session(User.builder().id(1L).role(Role.USER).build(), Instant.now());
        when(sessionResolver.resolve("abc.def.ghi")).thenReturn(session);

        assertThat(filterWithHeader("bearer abc.def.ghi").requireSession()).isSameAs(session);
    }

    @Test
    @DisplayName("Non-bearer or empty credentials are unauthenticated without a lookup")
    void shouldRejectMalformedHeader() throws Exception {
        assertThatThrownBy(() -> filterWithHeader("InvalidFormat token").requireSession())
                .isInstanceOf(UnauthenticatedException.class);
        assertThatThrownBy(() -> filterWithHeader("Bearer ").requireSession())
                .isInstanceOf(UnauthenticatedException.class);
        assertThatThrownBy(() -> filterWithHeader("Basic dXNlcjpwYXNz").requireSession())
                .isInstanceOf(UnauthenticatedException.class);
        verifyNoInteractions(sessionResolver);
    }

    @Test
    @DisplayName("Resolution failures are recorded, not thrown")
    void shouldRecordFailure() throws Exception {
        when(sessionResolver.resolve("stale")).thenThrow(new AccountInactiveException());

        SessionOutcome outcome = filterWithHeader("Bearer stale");

        assertThat(outcome.user()).isEmpty();
        assertThatThrownBy(outcome::requireSession).isInstanceOf(AccountInactiveException.class);
    }
}
