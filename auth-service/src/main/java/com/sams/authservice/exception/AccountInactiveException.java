package com.sams.authservice.exception;

public class AccountInactiveException extends RuntimeException {
    public AccountInactiveException() {
        super("Inactive user");
    }
}
