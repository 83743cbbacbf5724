package com.sams.authservice.exception;

import lombok.Getter;

@Getter
public class UserAlreadyExistsException extends RuntimeException {

    /** {@code "email"}, {@code "username"}, or null when the store could not say which. */
    private final String field;

    public UserAlreadyExistsException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static UserAlreadyExistsException emailTaken() {
        return new UserAlreadyExistsException("email", "Email already registered");
    }

    public static UserAlreadyExistsException usernameTaken() {
        return new UserAlreadyExistsException("username", "Username already registered");
    }
}
