package com.sams.authservice.config;

import io.jsonwebtoken.SignatureAlgorithm;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Token signing settings, bound once at startup from {@code auth.jwt.*}.
 * There is no default secret: a secret generated at boot would silently
 * invalidate every outstanding token on restart.
 */
@Getter
@ConfigurationProperties(prefix = "auth.jwt")
public class JwtProperties {

    private final String secret;
    private final SignatureAlgorithm algorithm;
    private final Duration expiration;
    private final long allowedClockSkewSeconds;

    public JwtProperties(String secret,
                         @DefaultValue("HS256") SignatureAlgorithm algorithm,
                         @DefaultValue("30") long expirationMinutes,
                         @DefaultValue("0") long allowedClockSkewSeconds) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("auth.jwt.secret must be configured (AUTH_JWT_SECRET)");
        }
        if (!algorithm.isHmac()) {
            throw new IllegalStateException("auth.jwt.algorithm must be an HMAC algorithm, got " + algorithm);
        }
        int keyBits = secret.getBytes(StandardCharsets.UTF_8).length * 8;
        if (keyBits < algorithm.getMinKeyLength()) {
            throw new IllegalStateException("auth.jwt.secret is too short for " + algorithm
                    + ": need at least " + algorithm.getMinKeyLength() / 8 + " bytes");
        }
        if (expirationMinutes <= 0) {
            throw new IllegalStateException("auth.jwt.expiration-minutes must be positive");
        }
        if (allowedClockSkewSeconds < 0) {
            throw new IllegalStateException("auth.jwt.allowed-clock-skew-seconds must not be negative");
        }
        this.secret = secret;
        this.algorithm = algorithm;
        this.expiration = Duration.ofMinutes(expirationMinutes);
        this.allowedClockSkewSeconds = allowedClockSkewSeconds;
    }
}
