package com.sams.authservice.config;

import com.sams.authservice.model.User;
import com.sams.authservice.security.TokenClaims;
import com.sams.authservice.security.TokenDecodeException;
import com.sams.authservice.security.TokenDecodeException.Reason;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the compact JWS bearer tokens. Claims: {@code sub} (email),
 * {@code role}, {@code user_id}, {@code iat}, {@code exp}.
 */
@Component
public class JwtUtil {

    public static final String ROLE_CLAIM = "role";
    public static final String USER_ID_CLAIM = "user_id";

    private final Key signingKey;
    private final SignatureAlgorithm algorithm;
    private final JwtProperties properties;
    private final Clock clock;

    public JwtUtil(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.algorithm = properties.getAlgorithm();
        this.signingKey = Keys.hmacShaKeyFor(properties.getSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(User user) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getExpiration());
        return Jwts.builder()
                .setHeaderParam("typ", "JWT")
                .setSubject(user.getEmail())
                .claim(ROLE_CLAIM, user.getRole().getValue())
                .claim(USER_ID_CLAIM, user.getId())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Verifies the signature, then the expiry, and only then reads the claims.
     *
     * @throws TokenDecodeException with the reason the token was rejected
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenDecodeException(Reason.MALFORMED, "Token is empty");
        }
        requireCanonicalSignature(token);
        Instant now = clock.instant();
        Jws<Claims> jws = parse(token, now);

        if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new TokenDecodeException(Reason.INVALID_SIGNATURE,
                    "Unexpected signing algorithm " + jws.getHeader().getAlgorithm());
        }

        Claims claims = jws.getBody();
        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new TokenDecodeException(Reason.MALFORMED, "Token has no expiry");
        }
        if (!now.isBefore(expiration.toInstant().plusSeconds(properties.getAllowedClockSkewSeconds()))) {
            throw new TokenDecodeException(Reason.EXPIRED, "Token expired at " + expiration.toInstant());
        }

        try {
            String subject = claims.getSubject();
            Long userId = claims.get(USER_ID_CLAIM, Long.class);
            if (subject == null || subject.isBlank() || userId == null) {
                throw new TokenDecodeException(Reason.MALFORMED, "Token is missing identity claims");
            }
            Date issuedAt = claims.getIssuedAt();
            return TokenClaims.builder()
                    .subject(subject)
                    .role(claims.get(ROLE_CLAIM, String.class))
                    .userId(userId)
                    .issuedAt(issuedAt != null ? issuedAt.toInstant() : null)
                    .expiresAt(expiration.toInstant())
                    .build();
        } catch (JwtException e) {
            throw new TokenDecodeException(Reason.MALFORMED, "Token claims have unexpected types", e);
        }
    }

    /**
     * The base64url decoder ignores the unused low bits of the last signature
     * character, so several spellings map to the same signature bytes. Only the
     * spelling this service would produce is accepted.
     */
    private static void requireCanonicalSignature(String token) {
        int dot = token.lastIndexOf('.');
        if (dot < 0 || dot == token.length() - 1) {
            // no signature segment; the parser reports these as malformed
            return;
        }
        String signature = token.substring(dot + 1);
        byte[] bytes;
        try {
            bytes = Decoders.BASE64URL.decode(signature);
        } catch (DecodingException e) {
            throw new TokenDecodeException(Reason.MALFORMED, "Token signature is not base64url", e);
        }
        if (!Encoders.BASE64URL.encode(bytes).equals(signature)) {
            throw new TokenDecodeException(Reason.INVALID_SIGNATURE, "Token signature does not verify");
        }
    }

    private Jws<Claims> parse(String token, Instant now) {
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(now))
                    .setAllowedClockSkewSeconds(properties.getAllowedClockSkewSeconds())
                    .build()
                    .parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            throw new TokenDecodeException(Reason.EXPIRED, "Token expired", e);
        } catch (SecurityException e) {
            throw new TokenDecodeException(Reason.INVALID_SIGNATURE, "Token signature does not verify", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenDecodeException(Reason.MALFORMED, "Token is malformed", e);
        }
    }
}
