package com.sams.authservice.exception;

/**
 * Identity could not be established from the request: no token, a token that
 * is expired, malformed or tampered with, or one whose user is gone. The
 * client always sees the same message.
 */
public class UnauthenticatedException extends RuntimeException {

    public static final String MESSAGE = "Could not validate credentials";

    public UnauthenticatedException() {
        super(MESSAGE);
    }

    public UnauthenticatedException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
