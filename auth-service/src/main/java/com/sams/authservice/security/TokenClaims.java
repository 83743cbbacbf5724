package com.sams.authservice.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Verified contents of a bearer token. */
@Value
@Builder
public class TokenClaims {
    String subject;
    String role;
    Long userId;
    Instant issuedAt;
    Instant expiresAt;
}
