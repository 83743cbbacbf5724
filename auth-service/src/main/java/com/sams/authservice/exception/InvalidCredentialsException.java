package com.sams.authservice.exception;

/** Wrong email or wrong password. The two cases are never told apart. */
public class InvalidCredentialsException extends RuntimeException {
    public InvalidCredentialsException() {
        super("Incorrect email or password");
    }
}
