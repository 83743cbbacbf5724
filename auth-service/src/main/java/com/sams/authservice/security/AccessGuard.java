package com.sams.authservice.security;

import com.sams.authservice.exception.ForbiddenException;
import com.sams.authservice.model.User;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Applies an {@link AccessPolicy} to the session the bearer token stage
 * attached to the request.
 */
@Component
public class AccessGuard {

    /**
     * @return the active user behind the request
     * @throws com.sams.authservice.exception.UnauthenticatedException no usable token
     * @throws com.sams.authservice.exception.AccountInactiveException the user is deactivated
     * @throws ForbiddenException the user's role is not permitted
     */
    public User require(HttpServletRequest request, AccessPolicy policy) {
        User user = RequestSessions.current(request).requireSession().getUser();
        if (!policy.permits(user.getRole())) {
            throw new ForbiddenException(policy.getRoles());
        }
        return user;
    }

    /** For endpoints open to anonymous callers: any resolution failure reads as "no user". */
    public Optional<User> optionalUser(HttpServletRequest request) {
        return RequestSessions.current(request).user();
    }
}
