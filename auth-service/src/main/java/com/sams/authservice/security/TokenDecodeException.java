package com.sams.authservice.security;

import lombok.Getter;

/**
 * Raised by {@link com.sams.authservice.config.JwtUtil#decode(String)}. Never
 * reaches a client: the session resolver turns every reason into the same
 * unauthenticated response.
 */
@Getter
public class TokenDecodeException extends RuntimeException {

    public enum Reason {
        INVALID_SIGNATURE,
        EXPIRED,
        MALFORMED
    }

    private final Reason reason;

    public TokenDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
