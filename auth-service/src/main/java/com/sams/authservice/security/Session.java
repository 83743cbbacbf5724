package com.sams.authservice.security;

import com.sams.authservice.model.User;
import lombok.Value;

import java.time.Instant;

/** A user resolved from a bearer token for the duration of one request. */
@Value
public class Session {
    User user;
    Instant validatedAt;
}
