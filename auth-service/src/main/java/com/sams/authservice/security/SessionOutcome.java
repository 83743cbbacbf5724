package com.sams.authservice.security;

import com.sams.authservice.exception.UnauthenticatedException;
import com.sams.authservice.model.User;

import java.util.Optional;

/**
 * What the bearer token stage found for the current request: no credentials at
 * all, a resolved session, or the failure that prevented one.
 */
public final class SessionOutcome {

    private static final SessionOutcome ANONYMOUS = new SessionOutcome(null, null);

    private final Session session;
    private final RuntimeException failure;

    private SessionOutcome(Session session, RuntimeException failure) {
        this.session = session;
        this.failure = failure;
    }

    public static SessionOutcome anonymous() {
        return ANONYMOUS;
    }

    public static SessionOutcome resolved(Session session) {
        return new SessionOutcome(session, null);
    }

    public static SessionOutcome failed(RuntimeException failure) {
        return new SessionOutcome(null, failure);
    }

    /**
     * @throws UnauthenticatedException when the request carried no token
     * @throws RuntimeException the resolution failure when the token was rejected
     */
    public Session requireSession() {
        if (session != null) {
            return session;
        }
        if (failure != null) {
            throw failure;
        }
        throw new UnauthenticatedException();
    }

    public Optional<User> user() {
        return Optional.ofNullable(session).map(Session::getUser);
    }
}
