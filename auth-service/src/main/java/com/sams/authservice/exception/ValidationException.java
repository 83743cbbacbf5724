package com.sams.authservice.exception;

import lombok.Getter;

import java.util.Map;

/** Input rejected by a rule that bean validation cannot express, e.g. the password policy. */
@Getter
public class ValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String field, String message) {
        super(message);
        this.fieldErrors = Map.of(field, message);
    }
}
