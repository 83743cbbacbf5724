package com.sams.authservice.security;

import jakarta.servlet.http.HttpServletRequest;

/** Request-attribute storage for the {@link SessionOutcome} of the current request. */
public final class RequestSessions {

    public static final String ATTRIBUTE = RequestSessions.class.getName() + ".OUTCOME";

    private RequestSessions() {}

    public static void attach(HttpServletRequest request, SessionOutcome outcome) {
        request.setAttribute(ATTRIBUTE, outcome);
    }

    public static SessionOutcome current(HttpServletRequest request) {
        Object outcome = request.getAttribute(ATTRIBUTE);
        return outcome instanceof SessionOutcome ? (SessionOutcome) outcome : SessionOutcome.anonymous();
    }
}
